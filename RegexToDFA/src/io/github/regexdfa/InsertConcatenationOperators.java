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
 * Make concatenation explicit in an infix regular expression,
 * e.g., <code>(a|b)*abb</code> becomes <code>(a|b)*.a.b.b</code>.
 */
public class InsertConcatenationOperators {
	private final Classifier classifier;
	
	/**
	 * Constructor.
	 * 
	 * @param classifier the {@link Classifier} to categorize characters with
	 */
	public InsertConcatenationOperators(Classifier classifier) {
		this.classifier = classifier;
	}
	
	/**
	 * Insert the concatenation operator wherever two adjacent
	 * subexpressions are implicitly concatenated.
	 * 
	 * @param infix the infix regular expression
	 * @return the infix regular expression with explicit concatenation
	 */
	public String execute(String infix) {
		if (infix.isEmpty())
			return "";
		
		StringBuilder buf = new StringBuilder();
		buf.append(infix.charAt(0));
		for (int i = 1; i < infix.length(); ++i) {
			char left = infix.charAt(i - 1);
			char right = infix.charAt(i);
			if (endsOperand(left) && beginsOperand(right))
				buf.append(OperatorTable.CONCAT);
			buf.append(right);
		}
		return buf.toString();
	}
	
	private boolean endsOperand(char c) {
		switch (classifier.classify(c)) {
		case REGULAR:
		case RIGHT_PAREN:
			return true;
		case OPERATOR:
			return classifier.getOperators().isUnaryPostfix(c);
		default:
			return false;
		}
	}
	
	private boolean beginsOperand(char c) {
		TokenType t = classifier.classify(c);
		return t == TokenType.REGULAR || t == TokenType.LEFT_PAREN;
	}
}
