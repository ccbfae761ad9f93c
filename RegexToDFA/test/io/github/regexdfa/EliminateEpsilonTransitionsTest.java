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

import static org.hamcrest.CoreMatchers.equalTo;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;

import org.junit.Test;

public class EliminateEpsilonTransitionsTest {
	private static final char E = FiniteAutomaton.EPSILON;
	
	private static FiniteAutomaton nfa(String regexp) {
		return new ConvertRegexpToDFA(Alphabet.parse("ab")).toNFA(regexp);
	}
	
	private static FiniteAutomaton eliminate(FiniteAutomaton nfa, FiniteAutomatonTransformerMode mode) {
		EliminateEpsilonTransitions eliminate = new EliminateEpsilonTransitions();
		eliminate.add(nfa);
		return eliminate.execute(mode);
	}
	
	@Test
	public void testNoEpsilonTransitionsRemain() {
		for (String regexp : Arrays.asList("a", "ab", "a|b", "a*", "a+", "a?", "(a|b)*abb", "((a*)*|b+)?a")) {
			FiniteAutomaton result = eliminate(nfa(regexp), FiniteAutomatonTransformerMode.DESTRUCTIVE);
			assertFalse(regexp, result.hasEpsilonTransitions());
		}
	}
	
	@Test
	public void testAcceptingPropagatesToStart() {
		FiniteAutomaton result = eliminate(nfa("a*"), FiniteAutomatonTransformerMode.DESTRUCTIVE);
		assertTrue(result.getStartState().isAccepting());
		
		result = eliminate(nfa("a+"), FiniteAutomatonTransformerMode.DESTRUCTIVE);
		assertFalse(result.getStartState().isAccepting());
	}
	
	@Test
	public void testTransitionsCopiedAcrossClosure() {
		FiniteAutomaton result = eliminate(nfa("(a|b)*abb"), FiniteAutomatonTransformerMode.DESTRUCTIVE);
		
		// start state 6 reaches 0 (a), 2 (b), and 8 (a) through ε-transitions
		assertThat(result.getState(6).getTransitions(),
				equalTo(Arrays.asList(new Transition(1, 'a'), new Transition(9, 'a'), new Transition(3, 'b'))));
		assertThat(result.getState(9).getTransitions(),
				equalTo(Arrays.asList(new Transition(11, 'b'))));
		assertThat(result.getAcceptingStates().size(), equalTo(1));
		assertThat(result.getUniqueAcceptingState().getNumber(), equalTo(13));
	}
	
	@Test
	public void testEpsilonCycle() {
		// 0 -ε-> 1 -ε-> 0, 1 -a-> 2, 2 accepting, 1 -ε-> 2
		FiniteAutomaton fa = new FiniteAutomaton();
		State s0 = fa.createState();
		State s1 = fa.createState();
		State s2 = fa.createState();
		s0.setStart(true);
		s2.setAccepting(true);
		fa.createTransition(s0, s1, E);
		fa.createTransition(s1, s0, E);
		fa.createTransition(s1, s2, 'a');
		fa.createTransition(s1, s2, E);
		
		FiniteAutomaton result = eliminate(fa, FiniteAutomatonTransformerMode.DESTRUCTIVE);
		assertFalse(result.hasEpsilonTransitions());
		assertTrue(result.getState(0).isAccepting());
		assertTrue(result.getState(1).isAccepting());
		assertThat(result.getState(0).getTransitions(), equalTo(Arrays.asList(new Transition(2, 'a'))));
		assertThat(result.getState(1).getTransitions(), equalTo(Arrays.asList(new Transition(2, 'a'))));
	}
	
	@Test
	public void testDuplicatesRemoved() {
		FiniteAutomaton fa = new FiniteAutomaton();
		State s0 = fa.createState();
		State s1 = fa.createState();
		State s2 = fa.createState();
		s0.setStart(true);
		s2.setAccepting(true);
		fa.createTransition(s0, s2, 'b');
		fa.createTransition(s0, s1, E);
		fa.createTransition(s1, s2, 'b');
		fa.createTransition(s1, s2, 'a');
		
		FiniteAutomaton result = eliminate(fa, FiniteAutomatonTransformerMode.DESTRUCTIVE);
		assertThat(result.getState(0).getTransitions(),
				equalTo(Arrays.asList(new Transition(2, 'a'), new Transition(2, 'b'))));
	}
	
	@Test
	public void testNondestructive() {
		FiniteAutomaton input = nfa("a?b");
		String before = input.toString();
		FiniteAutomaton result = eliminate(input, FiniteAutomatonTransformerMode.NONDESTRUCTIVE);
		assertThat(input.toString(), equalTo(before));
		assertTrue(input.hasEpsilonTransitions());
		assertFalse(result.hasEpsilonTransitions());
	}
}
