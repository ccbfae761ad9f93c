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
 * Outcome of converting a regular expression to a DFA: either a
 * valid DFA, or the {@link InvalidRegexpException} describing why
 * the expression is invalid. The intermediate forms of the expression
 * are recorded as far as the conversion got.
 */
public class CompilationResult {
	private final String infix;
	private final String withConcatenation;
	private final String postfix;
	private final FiniteAutomaton dfa;
	private final InvalidRegexpException error;
	
	private CompilationResult(String infix, String withConcatenation, String postfix,
			FiniteAutomaton dfa, InvalidRegexpException error) {
		this.infix = infix;
		this.withConcatenation = withConcatenation;
		this.postfix = postfix;
		this.dfa = dfa;
		this.error = error;
	}
	
	static CompilationResult valid(String infix, String withConcatenation, String postfix, FiniteAutomaton dfa) {
		return new CompilationResult(infix, withConcatenation, postfix, dfa, null);
	}
	
	static CompilationResult invalid(String infix, String withConcatenation, String postfix, InvalidRegexpException error) {
		return new CompilationResult(infix, withConcatenation, postfix, null, error);
	}
	
	/**
	 * @return true if the expression was converted to a DFA
	 */
	public boolean isValid() {
		return dfa != null;
	}
	
	/**
	 * @return the DFA
	 * @throws IllegalStateException if the expression was invalid
	 */
	public FiniteAutomaton getDFA() {
		if (dfa == null)
			throw new IllegalStateException("Invalid regular expression has no DFA");
		return dfa;
	}
	
	/**
	 * @return the error
	 * @throws IllegalStateException if the expression was valid
	 */
	public InvalidRegexpException getError() {
		if (error == null)
			throw new IllegalStateException("Valid regular expression has no error");
		return error;
	}
	
	public String getInfix() {
		return infix;
	}
	
	/**
	 * @return the infix expression with explicit concatenation
	 */
	public String getWithConcatenation() {
		return withConcatenation;
	}
	
	/**
	 * @return the postfix expression, or null if conversion to postfix failed
	 */
	public String getPostfix() {
		return postfix;
	}
}
