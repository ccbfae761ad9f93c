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
import java.util.BitSet;
import java.util.Collections;
import java.util.List;

/**
 * A finite automaton, either nondeterministic (possibly with
 * ε-transitions) or deterministic. States are kept in an arena and
 * addressed by their state number, which is their index in the arena.
 * Transitions refer to their target state by number.
 */
public class FiniteAutomaton {
	/**
	 * The symbol used to label ε-transitions.
	 * It can never be a member of an {@link Alphabet}.
	 */
	public static final char EPSILON = '\0';
	
	private final List<State> states;
	
	/**
	 * Constructor. Creates an automaton with no states.
	 */
	public FiniteAutomaton() {
		this.states = new ArrayList<State>();
	}
	
	/**
	 * Create a new state. Its number is the number of states
	 * that existed before it was created.
	 * 
	 * @return the new state
	 */
	public State createState() {
		State state = new State(states.size());
		states.add(state);
		return state;
	}
	
	/**
	 * Create a transition.
	 * 
	 * @param from   the source state
	 * @param to     the target state
	 * @param symbol the symbol, or {@link #EPSILON}
	 */
	public void createTransition(State from, State to, char symbol) {
		createTransition(from.getNumber(), to.getNumber(), symbol);
	}
	
	/**
	 * Create a transition between states identified by number.
	 * 
	 * @param from   the source state number
	 * @param to     the target state number
	 * @param symbol the symbol, or {@link #EPSILON}
	 */
	public void createTransition(int from, int to, char symbol) {
		checkStateNumber(from);
		checkStateNumber(to);
		states.get(from).getMutableTransitions().add(new Transition(to, symbol));
	}
	
	/**
	 * Get the state with given number.
	 * 
	 * @param number the state number
	 * @return the state
	 */
	public State getState(int number) {
		checkStateNumber(number);
		return states.get(number);
	}
	
	/**
	 * @return unmodifiable list of all states, in state number order
	 */
	public List<State> getStates() {
		return Collections.unmodifiableList(states);
	}
	
	/**
	 * @return the number of states
	 */
	public int getNumStates() {
		return states.size();
	}
	
	/**
	 * Get the unique start state.
	 * 
	 * @return the start state
	 * @throws IllegalStateException if there is no start state, or more than one
	 */
	public State getStartState() {
		State result = null;
		for (State s : states) {
			if (s.isStart()) {
				if (result != null)
					throw new IllegalStateException("Multiple start states");
				result = s;
			}
		}
		if (result == null)
			throw new IllegalStateException("No start state");
		return result;
	}
	
	/**
	 * Get the unique accepting state.
	 * 
	 * @return the accepting state
	 * @throws IllegalStateException if there isn't exactly one accepting state
	 */
	public State getUniqueAcceptingState() {
		List<State> accepting = getAcceptingStates();
		if (accepting.size() != 1)
			throw new IllegalStateException("Automaton has " + accepting.size() + " accepting states, expected 1");
		return accepting.get(0);
	}
	
	/**
	 * @return list of accepting states, in state number order
	 */
	public List<State> getAcceptingStates() {
		List<State> result = new ArrayList<State>();
		for (State s : states) {
			if (s.isAccepting())
				result.add(s);
		}
		return result;
	}
	
	/**
	 * @return true if any state has an ε-transition
	 */
	public boolean hasEpsilonTransitions() {
		for (State s : states) {
			for (Transition t : s.getTransitions()) {
				if (t.isEpsilon())
					return true;
			}
		}
		return false;
	}
	
	/**
	 * Check whether the automaton is deterministic: no ε-transitions,
	 * and at most one transition per (state, symbol) pair.
	 * 
	 * @return true if the automaton is deterministic
	 */
	public boolean isDeterministic() {
		for (State s : states) {
			BitSet seen = new BitSet();
			for (Transition t : s.getTransitions()) {
				if (t.isEpsilon() || seen.get(t.getSymbol()))
					return false;
				seen.set(t.getSymbol());
			}
		}
		return true;
	}
	
	/**
	 * Clear the transient traversal marks on all states.
	 */
	void clearMarks() {
		for (State s : states) {
			s.setVisited(false);
			s.setActive(false);
		}
	}
	
	/**
	 * Create a deep copy of this automaton. State numbers,
	 * flags, and transitions (in order) are preserved.
	 * 
	 * @return the copy
	 */
	public FiniteAutomaton copy() {
		FiniteAutomaton result = new FiniteAutomaton();
		for (State s : states) {
			State dup = result.createState();
			dup.setStart(s.isStart());
			dup.setAccepting(s.isAccepting());
		}
		for (State s : states) {
			result.states.get(s.getNumber()).getMutableTransitions().addAll(s.getTransitions());
		}
		return result;
	}
	
	private void checkStateNumber(int number) {
		if (number < 0 || number >= states.size())
			throw new IllegalArgumentException("Invalid state number " + number);
	}
	
	@Override
	public String toString() {
		StringBuilder buf = new StringBuilder();
		for (State s : states) {
			buf.append(s);
			if (s.isStart())
				buf.append(" (start)");
			if (s.isAccepting())
				buf.append(" (accepting)");
			buf.append(":");
			for (Transition t : s.getTransitions()) {
				buf.append(' ');
				buf.append(t);
			}
			buf.append('\n');
		}
		return buf.toString();
	}
}
