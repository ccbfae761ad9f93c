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

import java.util.BitSet;

/**
 * An immutable set of state numbers, used as the identity of a DFA state
 * during subset construction. Two StateSets are equal exactly when they
 * contain the same state numbers, no matter in which order the
 * members were discovered.
 */
public final class StateSet {
	private final BitSet members;
	
	/**
	 * Constructor.
	 * 
	 * @param members the member state numbers (copied)
	 */
	public StateSet(BitSet members) {
		this.members = (BitSet) members.clone();
	}
	
	/**
	 * Create a StateSet from explicit state numbers.
	 * 
	 * @param stateNumbers the state numbers
	 * @return the StateSet
	 */
	public static StateSet of(int... stateNumbers) {
		BitSet bits = new BitSet();
		for (int n : stateNumbers)
			bits.set(n);
		return new StateSet(bits);
	}
	
	public boolean contains(int stateNumber) {
		return members.get(stateNumber);
	}
	
	public boolean isEmpty() {
		return members.isEmpty();
	}
	
	public int size() {
		return members.cardinality();
	}
	
	/**
	 * @return the member state numbers in ascending order
	 */
	public int[] toArray() {
		return members.stream().toArray();
	}
	
	@Override
	public boolean equals(Object obj) {
		if (obj == null || obj.getClass() != this.getClass())
			return false;
		return members.equals(((StateSet) obj).members);
	}
	
	@Override
	public int hashCode() {
		return members.hashCode();
	}
	
	@Override
	public String toString() {
		return members.toString();
	}
}
