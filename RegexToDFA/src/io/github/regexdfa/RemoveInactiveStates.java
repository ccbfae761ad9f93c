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
import java.util.Deque;

/**
 * Remove states which are unreachable from the start state, or from which
 * no accepting state can be reached. The remaining states are renumbered
 * consecutively, preserving their relative order. The start state is
 * always kept, even if the automaton accepts nothing.
 */
public class RemoveInactiveStates extends FiniteAutomatonTransformer {
	
	@Override
	protected FiniteAutomaton transform(FiniteAutomaton fa) {
		fa.clearMarks();
		State start = fa.getStartState();
		
		markReachable(fa, start);
		markActive(fa);
		start.setActive(true);
		
		// Assign new numbers to active states
		int[] renumber = new int[fa.getNumStates()];
		FiniteAutomaton result = new FiniteAutomaton();
		for (State s : fa.getStates()) {
			if (s.isActive()) {
				State dup = result.createState();
				dup.setStart(s.isStart());
				dup.setAccepting(s.isAccepting());
				renumber[s.getNumber()] = dup.getNumber();
			} else {
				renumber[s.getNumber()] = -1;
			}
		}
		
		// Copy transitions between active states
		for (State s : fa.getStates()) {
			if (!s.isActive())
				continue;
			for (Transition t : s.getTransitions()) {
				int target = renumber[t.getTarget()];
				if (target >= 0)
					result.createTransition(renumber[s.getNumber()], target, t.getSymbol());
			}
		}
		
		fa.clearMarks();
		return result;
	}
	
	private void markReachable(FiniteAutomaton fa, State start) {
		Deque<State> worklist = new ArrayDeque<State>();
		start.setVisited(true);
		worklist.push(start);
		while (!worklist.isEmpty()) {
			State s = worklist.pop();
			for (Transition t : s.getTransitions()) {
				State target = fa.getState(t.getTarget());
				if (!target.isVisited()) {
					target.setVisited(true);
					worklist.push(target);
				}
			}
		}
	}
	
	private void markActive(FiniteAutomaton fa) {
		// Iterate to a fixpoint: a reachable state is active if it is
		// accepting or has a transition to an active state
		boolean changed = true;
		while (changed) {
			changed = false;
			for (State s : fa.getStates()) {
				if (!s.isVisited() || s.isActive())
					continue;
				if (s.isAccepting() || hasActiveTarget(fa, s)) {
					s.setActive(true);
					changed = true;
				}
			}
		}
	}
	
	private boolean hasActiveTarget(FiniteAutomaton fa, State s) {
		for (Transition t : s.getTransitions()) {
			if (fa.getState(t.getTarget()).isActive())
				return true;
		}
		return false;
	}
}
