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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * A TransitionSet is a set of transitions from one state to the same
 * target state. This is useful to label a single edge with all of
 * the symbols which lead from one state to another.
 */
public class TransitionSet implements Comparable<TransitionSet> {
	private SortedSet<Character> charSet;
	private int targetStateNumber;
	
	/**
	 * Constructor.
	 * 
	 * @param targetStateNumber the state number of the target state
	 *                          for the transitions in the transition set
	 */
	public TransitionSet(int targetStateNumber) {
		this.charSet = new TreeSet<Character>();
		this.targetStateNumber = targetStateNumber;
	}
	
	/**
	 * Group transitions by target state.
	 * 
	 * @param transitions the outgoing transitions of a state (must not include ε-transitions)
	 * @return list of {@link TransitionSet}s, in ascending order of target state number
	 */
	public static List<TransitionSet> group(Collection<Transition> transitions) {
		SortedMap<Integer, TransitionSet> targetStateToTransitionSet = new TreeMap<Integer, TransitionSet>();
		for (Transition t : transitions) {
			if (t.isEpsilon())
				throw new IllegalArgumentException("Can't group ε-transitions");
			TransitionSet transitionSet = targetStateToTransitionSet.get(t.getTarget());
			if (transitionSet == null) {
				transitionSet = new TransitionSet(t.getTarget());
				targetStateToTransitionSet.put(t.getTarget(), transitionSet);
			}
			transitionSet.addChar(t.getSymbol());
		}
		return new ArrayList<TransitionSet>(targetStateToTransitionSet.values());
	}
	
	/**
	 * Add a character to the transition set, indicating that there
	 * is a transition on this character to the transition set's
	 * target state.
	 * 
	 * @param ch a character
	 */
	public void addChar(char ch) {
		charSet.add(ch);
	}
	
	/**
	 * Get the character set.
	 * 
	 * @return the character set
	 */
	public SortedSet<Character> getCharSet() {
		return Collections.unmodifiableSortedSet(charSet);
	}

	/**
	 * Get the target state number.
	 * 
	 * @return the target state number
	 */
	public int getTargetStateNumber() {
		return targetStateNumber;
	}

	/**
	 * Return the number of transitions in this
	 * transition set.
	 * 
	 * @return number of transitions
	 */
	public int size() {
		return charSet.size();
	}

	@Override
	public int compareTo(TransitionSet o) {
		return targetStateNumber - o.targetStateNumber;
	}

	/**
	 * Get the characters of the transition set joined by a separator,
	 * e.g. "a,b,c".
	 * 
	 * @param separator the separator
	 * @return the joined characters
	 */
	public String membersAsString(String separator) {
		StringBuilder buf = new StringBuilder();
		for (Character c : charSet) {
			if (buf.length() > 0)
				buf.append(separator);
			buf.append(c.charValue());
		}
		return buf.toString();
	}
}
