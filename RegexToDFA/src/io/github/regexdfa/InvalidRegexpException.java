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
 * Exception thrown when a regular expression can't be converted
 * to an automaton.
 */
public class InvalidRegexpException extends IllegalArgumentException {
	private static final long serialVersionUID = 1L;
	
	/**
	 * Kinds of errors in regular expressions.
	 */
	public enum Kind {
		/** A character that is neither in the alphabet nor an operator or parenthesis. */
		LEXICAL,
		/** Mismatched parentheses. */
		UNBALANCED_PAREN,
		/** An operator with too few operands, or operands with no operator. */
		MALFORMED_EXPRESSION,
	}
	
	private final Kind kind;
	
	/**
	 * Constructor.
	 * 
	 * @param kind the kind of error
	 * @param msg  the error message
	 */
	public InvalidRegexpException(Kind kind, String msg) {
		super(msg);
		this.kind = kind;
	}
	
	/**
	 * @return the kind of error
	 */
	public Kind getKind() {
		return kind;
	}
}
