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
 * Convert a postfix regular expression to a nondeterministic finite
 * automaton (NFA) using Thompson's construction.
 * The resulting NFA has ε-transitions, a single start state,
 * and a single accepting state.
 */
public class ConvertPostfixToNFA {
	/**
	 * A partially-built piece of the NFA. The finish state has no
	 * outgoing transitions until the fragment is embedded
	 * by an enclosing operator.
	 */
	static class Fragment {
		final State start;
		final State finish;
		
		Fragment(State start, State finish) {
			this.start = start;
			this.finish = finish;
		}
	}
	
	private final Classifier classifier;
	
	private FiniteAutomaton nfa;
	private Deque<Fragment> stack;
	
	/**
	 * Constructor.
	 * 
	 * @param classifier the {@link Classifier} to categorize characters with
	 */
	public ConvertPostfixToNFA(Classifier classifier) {
		this.classifier = classifier;
	}
	
	/**
	 * Convert the postfix regular expression into an NFA.
	 * 
	 * @param postfix the postfix regular expression
	 * @return the NFA which recognizes the language specified by the regular expression
	 * @throws InvalidRegexpException if an operator lacks operands, or if the
	 *         expression doesn't reduce to exactly one automaton
	 */
	public FiniteAutomaton execute(String postfix) {
		nfa = new FiniteAutomaton();
		stack = new ArrayDeque<Fragment>();
		
		for (int i = 0; i < postfix.length(); ++i) {
			char c = postfix.charAt(i);
			
			if (classifier.classify(c) == TokenType.REGULAR) {
				// literal symbol
				State q = nfa.createState();
				State f = nfa.createState();
				nfa.createTransition(q, f, c);
				stack.push(new Fragment(q, f));
				continue;
			}
			
			switch (c) {
			case OperatorTable.CONCAT:
				concatenate();
				break;
			case OperatorTable.UNION:
				union();
				break;
			case OperatorTable.STAR:
				repeat(true, true);
				break;
			case OperatorTable.PLUS:
				repeat(false, true);
				break;
			case OperatorTable.OPTIONAL:
				repeat(true, false);
				break;
			default:
				throw new InvalidRegexpException(InvalidRegexpException.Kind.MALFORMED_EXPRESSION,
						"Unexpected symbol '" + c + "' in postfix expression");
			}
		}
		
		if (stack.size() != 1) {
			throw new InvalidRegexpException(InvalidRegexpException.Kind.MALFORMED_EXPRESSION,
					stack.isEmpty() ? "Empty expression" : "Missing operator (" + stack.size() + " subexpressions remain)");
		}
		
		Fragment result = stack.pop();
		result.start.setStart(true);
		result.finish.setAccepting(true);
		
		FiniteAutomaton ret = nfa;
		nfa = null;
		stack = null;
		return ret;
	}
	
	private void concatenate() {
		Fragment y = pop(OperatorTable.CONCAT);
		Fragment x = pop(OperatorTable.CONCAT);
		
		nfa.createTransition(x.finish, y.start, FiniteAutomaton.EPSILON);
		stack.push(new Fragment(x.start, y.finish));
	}
	
	private void union() {
		Fragment y = pop(OperatorTable.UNION);
		Fragment x = pop(OperatorTable.UNION);
		
		State q = nfa.createState();
		nfa.createTransition(q, x.start, FiniteAutomaton.EPSILON);
		nfa.createTransition(q, y.start, FiniteAutomaton.EPSILON);
		State f = nfa.createState();
		nfa.createTransition(x.finish, f, FiniteAutomaton.EPSILON);
		nfa.createTransition(y.finish, f, FiniteAutomaton.EPSILON);
		stack.push(new Fragment(q, f));
	}
	
	/**
	 * Handle the unary operators.
	 * '*' allows skipping and repeating, '+' only repeating, '?' only skipping.
	 * 
	 * @param allowZero   true to add the ε-transition skipping the operand
	 * @param allowRepeat true to add the ε-transition back to the operand's start
	 */
	private void repeat(boolean allowZero, boolean allowRepeat) {
		char op = allowZero ? (allowRepeat ? OperatorTable.STAR : OperatorTable.OPTIONAL) : OperatorTable.PLUS;
		Fragment x = pop(op);
		
		State q = nfa.createState();
		State f = nfa.createState();
		nfa.createTransition(q, x.start, FiniteAutomaton.EPSILON);
		if (allowZero)
			nfa.createTransition(q, f, FiniteAutomaton.EPSILON);
		if (allowRepeat)
			nfa.createTransition(x.finish, x.start, FiniteAutomaton.EPSILON);
		nfa.createTransition(x.finish, f, FiniteAutomaton.EPSILON);
		stack.push(new Fragment(q, f));
	}
	
	private Fragment pop(char op) {
		if (stack.isEmpty())
			throw new InvalidRegexpException(InvalidRegexpException.Kind.MALFORMED_EXPRESSION,
					"Operator '" + op + "' is missing an operand");
		return stack.pop();
	}
}
