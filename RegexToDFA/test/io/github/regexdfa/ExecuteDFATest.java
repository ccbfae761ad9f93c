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

import org.junit.Before;
import org.junit.Test;

public class ExecuteDFATest {
	private ExecuteDFA executeDFA;
	
	@Before
	public void setUp() {
		executeDFA = new ExecuteDFA();
		executeDFA.setAutomaton(new ConvertRegexpToDFA(Alphabet.parse("ab")).convertToDFA("(a|b)*abb", true));
	}
	
	@Test
	public void testTable() {
		assertThat(executeDFA.getMinCC(), equalTo((int) 'a'));
		int[][] table = executeDFA.getTable();
		assertThat(table.length, equalTo(5));
		assertThat(table[0].length, equalTo(2));
		assertThat(table[3][1], equalTo(4));
	}
	
	@Test
	public void testAccepts() {
		assertTrue(executeDFA.execute("abb"));
		assertTrue(executeDFA.execute("aabb"));
		assertTrue(executeDFA.execute("babababb"));
	}
	
	@Test
	public void testRejects() {
		assertFalse(executeDFA.execute(""));
		assertFalse(executeDFA.execute("ab"));
		assertFalse(executeDFA.execute("abba"));
		// symbols outside the table
		assertFalse(executeDFA.execute("abbc"));
		assertFalse(executeDFA.execute("Aabb"));
	}
	
	@Test
	public void testNoTransitions() {
		FiniteAutomaton fa = new FiniteAutomaton();
		State s = fa.createState();
		s.setStart(true);
		s.setAccepting(true);
		ExecuteDFA exec = new ExecuteDFA();
		exec.setAutomaton(fa);
		assertTrue(exec.execute(""));
		assertFalse(exec.execute("a"));
	}
	
	@Test
	public void testNondeterministicRejected() {
		FiniteAutomaton fa = new FiniteAutomaton();
		State s0 = fa.createState();
		State s1 = fa.createState();
		s0.setStart(true);
		fa.createTransition(s0, s0, 'a');
		fa.createTransition(s0, s1, 'a');
		assertThrows(IllegalArgumentException.class, () -> new ExecuteDFA().setAutomaton(fa));
	}
	
	@Test
	public void testNoAutomaton() {
		assertThrows(IllegalStateException.class, () -> new ExecuteDFA().execute("a"));
	}
}
