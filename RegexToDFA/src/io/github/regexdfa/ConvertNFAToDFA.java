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
import java.util.BitSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Queue;

/**
 * Convert an NFA without ε-transitions into a DFA using the
 * subset construction. Each DFA state corresponds to the set of NFA
 * states reachable from the NFA start state on some input string.
 * DFA states are numbered in breadth-first discovery order, so the
 * start state is always state 0.
 */
public class ConvertNFAToDFA extends FiniteAutomatonTransformer {
	private final Alphabet alphabet;
	
	// Map of NFA state sets to DFA states, and the reverse mapping
	private Map<StateSet, State> nfaStateSetToDFAState;
	private List<StateSet> dfaStateToNFAStateSet;
	
	/**
	 * Constructor.
	 * 
	 * @param alphabet the alphabet; DFA transitions are computed for its
	 *                 symbols in ascending order
	 */
	public ConvertNFAToDFA(Alphabet alphabet) {
		this.alphabet = alphabet;
	}
	
	@Override
	protected FiniteAutomaton transform(FiniteAutomaton nfa) {
		if (nfa.hasEpsilonTransitions())
			throw new IllegalArgumentException("NFA must not have ε-transitions");
		
		FiniteAutomaton dfa = new FiniteAutomaton();
		nfaStateSetToDFAState = new HashMap<StateSet, State>();
		dfaStateToNFAStateSet = new ArrayList<StateSet>();
		Queue<StateSet> queue = new ArrayDeque<StateSet>();
		
		StateSet startSet = StateSet.of(nfa.getStartState().getNumber());
		State dfaStart = findOrCreateDFAState(dfa, startSet, queue);
		dfaStart.setStart(true);
		
		while (!queue.isEmpty()) {
			StateSet nfaStates = queue.remove();
			State dfaState = nfaStateSetToDFAState.get(nfaStates);
			
			for (int n : nfaStates.toArray()) {
				if (nfa.getState(n).isAccepting()) {
					dfaState.setAccepting(true);
					break;
				}
			}
			
			for (Character symbol : alphabet) {
				BitSet targets = new BitSet();
				for (int n : nfaStates.toArray()) {
					for (Transition t : nfa.getState(n).getTransitions()) {
						if (t.getSymbol() == symbol.charValue())
							targets.set(t.getTarget());
					}
				}
				if (targets.isEmpty())
					continue;
				
				State target = findOrCreateDFAState(dfa, new StateSet(targets), queue);
				dfa.createTransition(dfaState, target, symbol.charValue());
			}
		}
		
		return dfa;
	}
	
	private State findOrCreateDFAState(FiniteAutomaton dfa, StateSet nfaStates, Queue<StateSet> queue) {
		State dfaState = nfaStateSetToDFAState.get(nfaStates);
		if (dfaState == null) {
			dfaState = dfa.createState();
			nfaStateSetToDFAState.put(nfaStates, dfaState);
			dfaStateToNFAStateSet.add(nfaStates);
			queue.add(nfaStates);
		}
		return dfaState;
	}
	
	/**
	 * Get the set of NFA states represented by a DFA state
	 * created by the most recent execution.
	 * 
	 * @param dfaState a DFA state
	 * @return the corresponding set of NFA state numbers
	 */
	public StateSet getNFAStateSetForDFAState(State dfaState) {
		if (dfaStateToNFAStateSet == null)
			throw new IllegalStateException("Conversion hasn't been executed");
		return dfaStateToNFAStateSet.get(dfaState.getNumber());
	}
}
