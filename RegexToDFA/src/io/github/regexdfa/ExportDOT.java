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

/**
 * Export a finite automaton in the DOT language, for rendering
 * with Graphviz (e.g., <code>dot -Tsvg graph.dot &gt;graph.svg</code>).
 */
public class ExportDOT {
	private static final String PREAMBLE =
			"digraph DFA {\n" +
			"  rankdir=LR;\n" +
			"  node [shape=circle];\n" +
			"  __start [shape=point];\n";
	
	/**
	 * Write the automaton as a DOT digraph. The caller is responsible
	 * for closing the writer.
	 * 
	 * @param fa  the automaton (must not have ε-transitions)
	 * @param out the writer to write to
	 */
	public void export(FiniteAutomaton fa, PrintWriter out) {
		out.write(PREAMBLE);
		
		// Accepting states are drawn as double circles
		for (State s : fa.getStates()) {
			out.printf("  %s [shape=%s];\n", s, s.isAccepting() ? "doublecircle" : "circle");
		}
		
		out.printf("  __start -> %s;\n", fa.getStartState());
		
		// One edge per target state, labeled with all of its symbols
		for (State s : fa.getStates()) {
			for (TransitionSet ts : TransitionSet.group(s.getTransitions())) {
				out.printf("  %s -> q%d [label=\"%s\"];\n",
						s, ts.getTargetStateNumber(), ts.membersAsString(","));
			}
		}
		
		out.write("}\n");
		out.flush();
	}
}
