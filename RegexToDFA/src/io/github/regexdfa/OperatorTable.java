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
 * The regular expression operators and their precedences.
 * Higher precedence binds tighter; all operators are left-associative.
 */
public final class OperatorTable {
	/** Explicit concatenation operator. */
	public static final char CONCAT = '.';
	/** Union (disjunction) operator. */
	public static final char UNION = '|';
	/** Kleene star: zero or more. */
	public static final char STAR = '*';
	/** One or more. */
	public static final char PLUS = '+';
	/** Zero or one. */
	public static final char OPTIONAL = '?';
	
	public static final char LEFT_PAREN = '(';
	public static final char RIGHT_PAREN = ')';
	
	private static final OperatorTable DEFAULT = new OperatorTable();
	
	private OperatorTable() {
	}
	
	/**
	 * @return the standard operator table
	 */
	public static OperatorTable getDefault() {
		return DEFAULT;
	}
	
	/**
	 * Get the precedence of an operator.
	 * 
	 * @param op a character
	 * @return the precedence (1-3), or 0 if the character isn't an operator
	 */
	public int getPrecedence(char op) {
		switch (op) {
		case STAR:
		case PLUS:
		case OPTIONAL:
			return 3;
		case CONCAT:
			return 2;
		case UNION:
			return 1;
		default:
			return 0;
		}
	}
	
	public boolean isOperator(char c) {
		return getPrecedence(c) > 0;
	}
	
	/**
	 * @param c a character
	 * @return true if the character is a unary postfix operator (*, +, ?)
	 */
	public boolean isUnaryPostfix(char c) {
		return c == STAR || c == PLUS || c == OPTIONAL;
	}
	
	/**
	 * @param c a character
	 * @return true if the character is an operator or a parenthesis
	 */
	public boolean isMetacharacter(char c) {
		return isOperator(c) || c == LEFT_PAREN || c == RIGHT_PAREN;
	}
}
