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
import static org.junit.Assert.assertThat;

import org.junit.Before;
import org.junit.Test;

public class ClassifierTest {
	private Classifier classifier;
	
	@Before
	public void setUp() {
		classifier = new Classifier(Alphabet.parse("ab01"), OperatorTable.getDefault());
	}
	
	@Test
	public void testAlphabetSymbols() {
		assertThat(classifier.classify('a'), equalTo(TokenType.REGULAR));
		assertThat(classifier.classify('b'), equalTo(TokenType.REGULAR));
		assertThat(classifier.classify('0'), equalTo(TokenType.REGULAR));
		assertThat(classifier.classify('1'), equalTo(TokenType.REGULAR));
	}
	
	@Test
	public void testOperators() {
		for (char c : "*+?.|".toCharArray())
			assertThat(classifier.classify(c), equalTo(TokenType.OPERATOR));
	}
	
	@Test
	public void testParens() {
		assertThat(classifier.classify('('), equalTo(TokenType.LEFT_PAREN));
		assertThat(classifier.classify(')'), equalTo(TokenType.RIGHT_PAREN));
	}
	
	@Test
	public void testInvalid() {
		assertThat(classifier.classify('c'), equalTo(TokenType.INVALID));
		assertThat(classifier.classify('A'), equalTo(TokenType.INVALID));
		assertThat(classifier.classify(' '), equalTo(TokenType.INVALID));
		assertThat(classifier.classify('['), equalTo(TokenType.INVALID));
		assertThat(classifier.classify(FiniteAutomaton.EPSILON), equalTo(TokenType.INVALID));
	}
	
	@Test
	public void testPrecedence() {
		OperatorTable ops = OperatorTable.getDefault();
		assertThat(ops.getPrecedence('*'), equalTo(3));
		assertThat(ops.getPrecedence('+'), equalTo(3));
		assertThat(ops.getPrecedence('?'), equalTo(3));
		assertThat(ops.getPrecedence('.'), equalTo(2));
		assertThat(ops.getPrecedence('|'), equalTo(1));
		assertThat(ops.getPrecedence('('), equalTo(0));
		assertThat(ops.getPrecedence('a'), equalTo(0));
	}
}
