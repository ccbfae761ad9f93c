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

/**
 * Determine the {@link TokenType} of characters in a regular expression.
 */
public class Classifier {
	private final Alphabet alphabet;
	private final OperatorTable operators;
	
	/**
	 * Constructor.
	 * 
	 * @param alphabet  the alphabet
	 * @param operators the operator table
	 */
	public Classifier(Alphabet alphabet, OperatorTable operators) {
		this.alphabet = alphabet;
		this.operators = operators;
	}
	
	/**
	 * Classify a character.
	 * 
	 * @param c the character
	 * @return its token type; never null
	 */
	public TokenType classify(char c) {
		if (alphabet.contains(c))
			return TokenType.REGULAR;
		if (operators.isOperator(c))
			return TokenType.OPERATOR;
		if (c == OperatorTable.LEFT_PAREN)
			return TokenType.LEFT_PAREN;
		if (c == OperatorTable.RIGHT_PAREN)
			return TokenType.RIGHT_PAREN;
		return TokenType.INVALID;
	}
	
	public Alphabet getAlphabet() {
		return alphabet;
	}
	
	public OperatorTable getOperators() {
		return operators;
	}
}
