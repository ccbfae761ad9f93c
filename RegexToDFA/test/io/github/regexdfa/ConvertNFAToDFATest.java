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
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;

import org.junit.Test;

public class ConvertNFAToDFATest {
	private static final Alphabet AB = Alphabet.parse("ab");
	
	private static FiniteAutomaton lambdaFreeNFA(String regexp) {
		FiniteAutomaton nfa = new ConvertRegexpToDFA(AB).toNFA(regexp);
		EliminateEpsilonTransitions eliminate = new EliminateEpsilonTransitions();
		eliminate.add(nfa);
		return eliminate.execute(FiniteAutomatonTransformerMode.DESTRUCTIVE);
	}
	
	@Test
	public void testTextbookExample() {
		ConvertNFAToDFA converter = new ConvertNFAToDFA(AB);
		converter.add(lambdaFreeNFA("(a|b)*abb"));
		FiniteAutomaton dfa = converter.execute(FiniteAutomatonTransformerMode.NONDESTRUCTIVE);
		
		assertThat(dfa.getNumStates(), equalTo(5));
		assertThat(dfa.getStartState().getNumber(), equalTo(0));
		assertThat(dfa.getAcceptingStates().size(), equalTo(1));
		assertThat(dfa.getUniqueAcceptingState().getNumber(), equalTo(4));
		
		int[][] expected = {
			// a, b
			{ 1, 2 },
			{ 1, 3 },
			{ 1, 2 },
			{ 1, 4 },
			{ 1, 2 },
		};
		for (int i = 0; i < expected.length; ++i) {
			State s = dfa.getState(i);
			assertThat(s.getTransitions().size(), equalTo(2));
			assertThat(s.getTarget('a'), equalTo(expected[i][0]));
			assertThat(s.getTarget('b'), equalTo(expected[i][1]));
		}
		
		// DFA states correspond to sets of NFA states
		assertThat(converter.getNFAStateSetForDFAState(dfa.getState(0)), equalTo(StateSet.of(6)));
		assertThat(converter.getNFAStateSetForDFAState(dfa.getState(1)), equalTo(StateSet.of(9, 1)));
		assertThat(converter.getNFAStateSetForDFAState(dfa.getState(4)), equalTo(StateSet.of(3, 13)));
	}
	
	@Test
	public void testDeterministic() {
		for (String regexp : Arrays.asList("a", "a|b", "a|ab", "(a|ab)(b|ba)", "(a*b*)*", "(a|b)*a(a|b)(a|b)", "a?a?aa")) {
			ConvertNFAToDFA converter = new ConvertNFAToDFA(AB);
			converter.add(lambdaFreeNFA(regexp));
			FiniteAutomaton dfa = converter.execute(FiniteAutomatonTransformerMode.DESTRUCTIVE);
			assertTrue(regexp, dfa.isDeterministic());
			assertThat(dfa.getStartState().getNumber(), equalTo(0));
		}
	}
	
	@Test
	public void testNoTransitionForMissingSymbol() {
		ConvertNFAToDFA converter = new ConvertNFAToDFA(AB);
		converter.add(lambdaFreeNFA("a"));
		FiniteAutomaton dfa = converter.execute(FiniteAutomatonTransformerMode.DESTRUCTIVE);
		
		assertThat(dfa.getNumStates(), equalTo(2));
		assertThat(dfa.getState(0).getTarget('b'), equalTo(-1));
		assertThat(dfa.getState(1).getTransitions().size(), equalTo(0));
		assertFalse(dfa.getState(0).isAccepting());
		assertTrue(dfa.getState(1).isAccepting());
	}
	
	@Test
	public void testEpsilonTransitionsRejected() {
		ConvertNFAToDFA converter = new ConvertNFAToDFA(AB);
		converter.add(new ConvertRegexpToDFA(AB).toNFA("ab"));
		assertThrows(IllegalArgumentException.class,
				() -> converter.execute(FiniteAutomatonTransformerMode.NONDESTRUCTIVE));
	}
	
	@Test
	public void testNotExecuted() {
		ConvertNFAToDFA converter = new ConvertNFAToDFA(AB);
		FiniteAutomaton fa = new FiniteAutomaton();
		State s = fa.createState();
		assertThrows(IllegalStateException.class, () -> converter.getNFAStateSetForDFAState(s));
	}
}
