// RegexToDFA - Convert regular expressions to deterministic finite automata
// Copyright (C) 2013,2017,2026 David H. Hovemeyer <david.hovemeyer@gmail.com>
//
// Permission is hereby granted, free of charge, to any person obtaining
// a copy of this software and associated documentation files (the
// "Software"), to deal in the Software without restriction, including
// without limitation the rights to use, copy, modify, merge, publish,
// distribute, sublicense, and/or sell copies of the Software, and to
// permit persons to whom the Software is furnished to do so, subject to
// the following conditions:
// 
// The above copyright notice and this permission notice shall be included
// in all copies or substantial portions of the Software.
// 
// THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND,
// EXPRESS OR IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF
// MERCHANTABILITY, FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT.
// IN NO EVENT SHALL THE AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY
// CLAIM, DAMAGES OR OTHER LIABILITY, WHETHER IN AN ACTION OF CONTRACT,
// TORT OR OTHERWISE, ARISING FROM, OUT OF OR IN CONNECTION WITH THE
// SOFTWARE OR THE USE OR OTHER DEALINGS IN THE SOFTWARE.

package io.github.regexdfa;

/**
 * A transition to a target state on a symbol.
 * The symbol is either an alphabet character or {@link FiniteAutomaton#EPSILON}.
 * Transitions are immutable.
 */
public class Transition implements Comparable<Transition> {
	private final int target;
	private final char symbol;
	
	/**
	 * Constructor.
	 * 
	 * @param target the target state number
	 * @param symbol the symbol
	 */
	public Transition(int target, char symbol) {
		this.target = target;
		this.symbol = symbol;
	}
	
	/**
	 * @return the target state number
	 */
	public int getTarget() {
		return target;
	}
	
	/**
	 * @return the symbol
	 */
	public char getSymbol() {
		return symbol;
	}
	
	/**
	 * @return true if this is an ε-transition
	 */
	public boolean isEpsilon() {
		return symbol == FiniteAutomaton.EPSILON;
	}
	
	@Override
	public int compareTo(Transition o) {
		// Order by symbol, then by target state
		if (symbol != o.symbol)
			return symbol - o.symbol;
		return target - o.target;
	}
	
	@Override
	public boolean equals(Object obj) {
		if (obj == null || obj.getClass() != this.getClass())
			return false;
		Transition other = (Transition) obj;
		return target == other.target && symbol == other.symbol;
	}
	
	@Override
	public int hashCode() {
		return target * 31 + symbol;
	}
	
	@Override
	public String toString() {
		return "--" + (isEpsilon() ? "ε" : String.valueOf(symbol)) + "--> q" + target;
	}
}
