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
 * Base class for algorithms which take a finite automaton as input
 * and produce a finite automaton as output.
 * Usage: {@link #add(FiniteAutomaton)} the input, then
 * call {@link #execute(FiniteAutomatonTransformerMode)}.
 */
public abstract class FiniteAutomatonTransformer {
	private FiniteAutomaton input;
	
	/**
	 * Set the input automaton.
	 * 
	 * @param fa the input automaton
	 */
	public void add(FiniteAutomaton fa) {
		if (input != null)
			throw new IllegalStateException(getClass().getSimpleName() + " accepts only one input automaton");
		this.input = fa;
	}
	
	/**
	 * Execute the transformation.
	 * 
	 * @param mode {@link FiniteAutomatonTransformerMode#DESTRUCTIVE} if the input
	 *             may be modified, {@link FiniteAutomatonTransformerMode#NONDESTRUCTIVE}
	 *             if it must be preserved
	 * @return the result automaton
	 */
	public FiniteAutomaton execute(FiniteAutomatonTransformerMode mode) {
		if (input == null)
			throw new IllegalStateException("No input automaton");
		FiniteAutomaton fa = (mode == FiniteAutomatonTransformerMode.NONDESTRUCTIVE) ? input.copy() : input;
		return transform(fa);
	}
	
	/**
	 * Subclasses implement the transformation here.
	 * 
	 * @param fa the automaton to transform; it may be modified
	 * @return the result automaton (may be <code>fa</code> itself)
	 */
	protected abstract FiniteAutomaton transform(FiniteAutomaton fa);
}
