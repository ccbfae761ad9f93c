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

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Convert a regular expression to a deterministic finite automaton.
 * The conversion is a pipeline:
 * <ol>
 * <li>insert explicit concatenation operators</li>
 * <li>convert infix to postfix (shunting yard)</li>
 * <li>build an NFA from the postfix expression (Thompson's construction)</li>
 * <li>eliminate ε-transitions</li>
 * <li>convert the NFA to a DFA (subset construction)</li>
 * <li>optionally, remove unreachable and dead states</li>
 * </ol>
 * Instances may be reused for any number of conversions, but must not be
 * shared between threads.
 */
public class ConvertRegexpToDFA {
	private static final Logger logger = Logger.getLogger("io.github.regexdfa");
	
	private final Alphabet alphabet;
	private final InsertConcatenationOperators insertConcat;
	private final ConvertInfixToPostfix infixToPostfix;
	private final ConvertPostfixToNFA postfixToNFA;
	
	/**
	 * Constructor.
	 * 
	 * @param alphabet the alphabet of the regular expressions
	 */
	public ConvertRegexpToDFA(Alphabet alphabet) {
		this.alphabet = alphabet;
		OperatorTable operators = OperatorTable.getDefault();
		Classifier classifier = new Classifier(alphabet, operators);
		this.insertConcat = new InsertConcatenationOperators(classifier);
		this.infixToPostfix = new ConvertInfixToPostfix(classifier, operators);
		this.postfixToNFA = new ConvertPostfixToNFA(classifier);
	}
	
	public Alphabet getAlphabet() {
		return alphabet;
	}
	
	/**
	 * @param regexp an infix regular expression
	 * @return the regular expression with explicit concatenation
	 */
	public String insertConcatenation(String regexp) {
		return insertConcat.execute(regexp);
	}
	
	/**
	 * @param regexp an infix regular expression
	 * @return the postfix form of the regular expression
	 * @throws InvalidRegexpException if the regular expression is invalid
	 */
	public String toPostfix(String regexp) {
		return infixToPostfix.execute(insertConcat.execute(regexp));
	}
	
	/**
	 * @param regexp an infix regular expression
	 * @return the NFA (with ε-transitions) built by Thompson's construction
	 * @throws InvalidRegexpException if the regular expression is invalid
	 */
	public FiniteAutomaton toNFA(String regexp) {
		return postfixToNFA.execute(toPostfix(regexp));
	}
	
	/**
	 * Convert a regular expression to a DFA.
	 * 
	 * @param regexp an infix regular expression
	 * @param prune  true to remove unreachable and dead states
	 * @return the DFA
	 * @throws InvalidRegexpException if the regular expression is invalid
	 */
	public FiniteAutomaton convertToDFA(String regexp, boolean prune) {
		return compile(regexp, prune, true).getDFA();
	}
	
	/**
	 * Convert a regular expression to a DFA, reporting an invalid
	 * expression in the result rather than by throwing an exception.
	 * 
	 * @param regexp an infix regular expression
	 * @param prune  true to remove unreachable and dead states
	 * @return the {@link CompilationResult}
	 */
	public CompilationResult compile(String regexp, boolean prune) {
		return compile(regexp, prune, false);
	}
	
	private CompilationResult compile(String regexp, boolean prune, boolean rethrow) {
		String withConcat = insertConcat.execute(regexp);
		String postfix = null;
		try {
			postfix = infixToPostfix.execute(withConcat);
			logger.log(Level.FINE, "{0}: explicit concatenation {1}, postfix {2}",
					new Object[] { regexp, withConcat, postfix });
			
			FiniteAutomaton nfa = postfixToNFA.execute(postfix);
			logger.log(Level.FINE, "{0}: NFA has {1} states", new Object[] { regexp, nfa.getNumStates() });
			
			EliminateEpsilonTransitions eliminate = new EliminateEpsilonTransitions();
			eliminate.add(nfa);
			nfa = eliminate.execute(FiniteAutomatonTransformerMode.DESTRUCTIVE);
			
			ConvertNFAToDFA converter = new ConvertNFAToDFA(alphabet);
			converter.add(nfa);
			FiniteAutomaton dfa = converter.execute(FiniteAutomatonTransformerMode.NONDESTRUCTIVE);
			logger.log(Level.FINE, "{0}: DFA has {1} states", new Object[] { regexp, dfa.getNumStates() });
			
			if (prune) {
				RemoveInactiveStates remove = new RemoveInactiveStates();
				remove.add(dfa);
				dfa = remove.execute(FiniteAutomatonTransformerMode.DESTRUCTIVE);
				logger.log(Level.FINE, "{0}: {1} active DFA states", new Object[] { regexp, dfa.getNumStates() });
			}
			
			return CompilationResult.valid(regexp, withConcat, postfix, dfa);
		} catch (InvalidRegexpException e) {
			logger.log(Level.FINE, "Invalid regular expression " + regexp, e);
			if (rethrow)
				throw e;
			return CompilationResult.invalid(regexp, withConcat, postfix, e);
		}
	}
}
