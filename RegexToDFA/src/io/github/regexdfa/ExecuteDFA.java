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

import java.util.Arrays;

/**
 * Execute a DFA on an input string.
 * The DFA is compiled into a transition table whose rows are states and
 * whose columns are character codes, starting at {@link #getMinCC()}.
 */
public class ExecuteDFA {
	private FiniteAutomaton dfa;
	private int minCC;
	private int[][] table;
	
	/**
	 * Set the DFA to execute, and build its transition table.
	 * 
	 * @param dfa the DFA
	 * @throws IllegalArgumentException if the automaton isn't deterministic
	 */
	public void setAutomaton(FiniteAutomaton dfa) {
		if (!dfa.isDeterministic())
			throw new IllegalArgumentException("Automaton is not deterministic");
		this.dfa = dfa;
		
		int min = Integer.MAX_VALUE, max = Integer.MIN_VALUE;
		for (State s : dfa.getStates()) {
			for (Transition t : s.getTransitions()) {
				min = Math.min(min, t.getSymbol());
				max = Math.max(max, t.getSymbol());
			}
		}
		if (min > max) {
			// no transitions at all
			min = 0;
			max = -1;
		}
		
		this.minCC = min;
		this.table = new int[dfa.getNumStates()][max - min + 1];
		for (State s : dfa.getStates()) {
			int[] row = table[s.getNumber()];
			Arrays.fill(row, -1);
			for (Transition t : s.getTransitions())
				row[t.getSymbol() - min] = t.getTarget();
		}
	}
	
	/**
	 * @return the character code of the first column of the transition table
	 */
	public int getMinCC() {
		return minCC;
	}
	
	/**
	 * @return the transition table; -1 entries mean there is no transition
	 */
	public int[][] getTable() {
		return table;
	}
	
	/**
	 * Determine whether the DFA accepts an input string.
	 * The entire string must be consumed.
	 * 
	 * @param input the input string
	 * @return true if the DFA accepts the input string, false otherwise
	 */
	public boolean execute(String input) {
		if (dfa == null)
			throw new IllegalStateException("No automaton");
		int state = dfa.getStartState().getNumber();
		for (int i = 0; i < input.length(); ++i) {
			int col = input.charAt(i) - minCC;
			int[] row = table[state];
			if (col < 0 || col >= row.length || row[col] < 0)
				return false;
			state = row[col];
		}
		return dfa.getState(state).isAccepting();
	}
}
