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
 * Convert an infix regular expression (with explicit concatenation)
 * to postfix form using the shunting yard algorithm.
 * E.g., <code>(a|b)*.a</code> becomes <code>ab|*a.</code>.
 */
public class ConvertInfixToPostfix {
	private final Classifier classifier;
	private final OperatorTable operators;
	
	/**
	 * Constructor.
	 * 
	 * @param classifier the {@link Classifier} to categorize characters with
	 * @param operators  the operator table defining precedences
	 */
	public ConvertInfixToPostfix(Classifier classifier, OperatorTable operators) {
		this.classifier = classifier;
		this.operators = operators;
	}
	
	/**
	 * Convert to postfix.
	 * 
	 * @param infix the infix regular expression, with explicit concatenation
	 * @return the postfix regular expression
	 * @throws InvalidRegexpException if the expression contains an invalid character
	 *         or has unbalanced parentheses
	 */
	public String execute(String infix) {
		StringBuilder postfix = new StringBuilder();
		Deque<Character> stack = new ArrayDeque<Character>();
		
		for (int i = 0; i < infix.length(); ++i) {
			char c = infix.charAt(i);
			switch (classifier.classify(c)) {
			case REGULAR:
				postfix.append(c);
				break;
				
			case OPERATOR:
				// Pop operators of equal or higher precedence (left associativity)
				while (!stack.isEmpty()
						&& stack.peek().charValue() != OperatorTable.LEFT_PAREN
						&& operators.getPrecedence(stack.peek()) >= operators.getPrecedence(c)) {
					postfix.append(stack.pop().charValue());
				}
				stack.push(c);
				break;
				
			case LEFT_PAREN:
				stack.push(c);
				break;
				
			case RIGHT_PAREN:
				while (!stack.isEmpty() && stack.peek().charValue() != OperatorTable.LEFT_PAREN)
					postfix.append(stack.pop().charValue());
				if (stack.isEmpty())
					throw new InvalidRegexpException(InvalidRegexpException.Kind.UNBALANCED_PAREN,
							"Unmatched ')'");
				stack.pop(); // discard the "("
				break;
				
			case INVALID:
				throw new InvalidRegexpException(InvalidRegexpException.Kind.LEXICAL,
						"Invalid character '" + c + "'");
			}
		}
		
		while (!stack.isEmpty()) {
			char op = stack.pop();
			if (op == OperatorTable.LEFT_PAREN)
				throw new InvalidRegexpException(InvalidRegexpException.Kind.UNBALANCED_PAREN, "Unmatched '('");
			postfix.append(op);
		}
		
		return postfix.toString();
	}
}
