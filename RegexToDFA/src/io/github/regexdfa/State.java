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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A state of a {@link FiniteAutomaton}.
 * States are owned by exactly one automaton and are identified
 * by their (dense) state number within it.
 */
public class State {
	private final int number;
	private boolean start;
	private boolean accepting;
	
	// transient traversal marks, cleared by whoever uses them
	private boolean visited;
	private boolean active;
	
	private final List<Transition> transitions;
	
	/**
	 * Constructor.
	 * Only {@link FiniteAutomaton#createState()} should create states.
	 * 
	 * @param number the state number
	 */
	State(int number) {
		this.number = number;
		this.transitions = new ArrayList<Transition>();
	}
	
	/**
	 * @return the state number (index in the owning automaton)
	 */
	public int getNumber() {
		return number;
	}
	
	public boolean isStart() {
		return start;
	}
	
	public void setStart(boolean start) {
		this.start = start;
	}
	
	/**
	 * @return true if this is an accepting (final) state
	 */
	public boolean isAccepting() {
		return accepting;
	}
	
	public void setAccepting(boolean accepting) {
		this.accepting = accepting;
	}
	
	boolean isVisited() {
		return visited;
	}
	
	void setVisited(boolean visited) {
		this.visited = visited;
	}
	
	boolean isActive() {
		return active;
	}
	
	void setActive(boolean active) {
		this.active = active;
	}
	
	/**
	 * Get the outgoing transitions of this state.
	 * 
	 * @return unmodifiable view of the outgoing transitions
	 */
	public List<Transition> getTransitions() {
		return Collections.unmodifiableList(transitions);
	}
	
	/**
	 * Get the target state number of the transition on given symbol.
	 * Only meaningful for deterministic automata.
	 * 
	 * @param symbol the symbol
	 * @return the target state number, or -1 if there is no transition on the symbol
	 */
	public int getTarget(char symbol) {
		for (Transition t : transitions) {
			if (t.getSymbol() == symbol)
				return t.getTarget();
		}
		return -1;
	}
	
	List<Transition> getMutableTransitions() {
		return transitions;
	}
	
	@Override
	public String toString() {
		return "q" + number;
	}
}
