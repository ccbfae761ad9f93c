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

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.List;

/**
 * Format a DFA as the 5-tuple (Q, Σ, δ, q0, F).
 * States are named q0, q1, etc. by state number.
 */
public class FormatFiveTuple {
	private final Alphabet alphabet;
	
	/**
	 * Constructor.
	 * 
	 * @param alphabet the alphabet of the DFA
	 */
	public FormatFiveTuple(Alphabet alphabet) {
		this.alphabet = alphabet;
	}
	
	/**
	 * Format the DFA to a string.
	 * 
	 * @param dfa the DFA
	 * @return the formatted 5-tuple
	 */
	public String format(FiniteAutomaton dfa) {
		StringWriter sw = new StringWriter();
		PrintWriter pw = new PrintWriter(sw);
		write(dfa, pw);
		pw.flush();
		return sw.toString();
	}
	
	/**
	 * Write the formatted DFA. The caller is responsible
	 * for flushing and closing the writer.
	 * 
	 * @param dfa the DFA
	 * @param out the writer to write to
	 */
	public void write(FiniteAutomaton dfa, PrintWriter out) {
		out.print("Q = ");
		out.print(joinStates(dfa.getStates()) + "\n");
		
		out.print("Σ = {");
		boolean first = true;
		for (Character c : alphabet) {
			if (!first)
				out.print(", ");
			first = false;
			out.print(c.charValue());
		}
		out.print("}\n");
		
		out.print("δ:\n");
		for (State s : dfa.getStates()) {
			for (Character c : alphabet) {
				int target = s.getTarget(c.charValue());
				if (target >= 0)
					out.printf("  δ(%s, %c) = %s\n", s, c.charValue(), dfa.getState(target));
			}
		}
		
		out.print("q0 = ");
		out.print(dfa.getStartState() + "\n");
		
		out.print("F = ");
		out.print(joinStates(dfa.getAcceptingStates()) + "\n");
	}
	
	private String joinStates(List<State> states) {
		StringBuilder buf = new StringBuilder();
		buf.append('{');
		for (State s : states) {
			if (buf.length() > 1)
				buf.append(", ");
			buf.append(s);
		}
		buf.append('}');
		return buf.toString();
	}
}
