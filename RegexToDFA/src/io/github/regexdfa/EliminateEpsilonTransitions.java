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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Remove all ε-transitions from an NFA without changing the
 * language it accepts.
 * First, every state gets a direct ε-transition to every state in its
 * ε-closure, and becomes accepting if its closure contains an accepting
 * state. Then each state copies the non-ε transitions of the states
 * it has ε-transitions to, and all ε-transitions are dropped.
 */
public class EliminateEpsilonTransitions extends FiniteAutomatonTransformer {
	
	@Override
	protected FiniteAutomaton transform(FiniteAutomaton fa) {
		computeClosures(fa);
		eliminate(fa);
		return fa;
	}
	
	private void computeClosures(FiniteAutomaton fa) {
		for (State u : fa.getStates()) {
			List<State> reached = findEpsilonReachable(fa, u);
			for (State v : reached) {
				if (v.isAccepting())
					u.setAccepting(true);
				fa.createTransition(u, v, FiniteAutomaton.EPSILON);
			}
		}
		fa.clearMarks();
	}
	
	/**
	 * Find all states reachable from given state using only ε-transitions
	 * (a path of at least one transition). The start state is part of
	 * the result only if it lies on an ε-cycle.
	 */
	private List<State> findEpsilonReachable(FiniteAutomaton fa, State from) {
		fa.clearMarks();
		
		List<State> reached = new ArrayList<State>();
		Deque<State> worklist = new ArrayDeque<State>();
		worklist.push(from);
		while (!worklist.isEmpty()) {
			State s = worklist.pop();
			for (Transition t : s.getTransitions()) {
				if (!t.isEpsilon())
					continue;
				State target = fa.getState(t.getTarget());
				if (!target.isVisited()) {
					target.setVisited(true);
					reached.add(target);
					worklist.push(target);
				}
			}
		}
		
		return reached;
	}
	
	private void eliminate(FiniteAutomaton fa) {
		// Copy the non-ε transitions reachable through one ε-transition.
		// Snapshot first, so that copies made in this pass aren't copied again.
		List<List<Transition>> snapshot = new ArrayList<List<Transition>>();
		for (State s : fa.getStates())
			snapshot.add(new ArrayList<Transition>(s.getTransitions()));
		
		for (State u : fa.getStates()) {
			List<Transition> transitions = u.getMutableTransitions();
			for (Transition t : snapshot.get(u.getNumber())) {
				if (!t.isEpsilon())
					continue;
				for (Transition vt : snapshot.get(t.getTarget())) {
					if (!vt.isEpsilon())
						transitions.add(vt);
				}
			}
		}
		
		// Drop ε-transitions, sort, and remove duplicates
		for (State u : fa.getStates()) {
			List<Transition> transitions = u.getMutableTransitions();
			Set<Transition> kept = new LinkedHashSet<Transition>();
			for (Transition t : transitions) {
				if (!t.isEpsilon())
					kept.add(t);
			}
			transitions.clear();
			transitions.addAll(kept);
			Collections.sort(transitions);
		}
	}
}
