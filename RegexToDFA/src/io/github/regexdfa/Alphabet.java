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

import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * An input alphabet: a non-empty set of symbol characters.
 * Iteration is in ascending order of character code.
 */
public final class Alphabet implements Iterable<Character> {
	/**
	 * Lowercase letters, the alphabet used when none is specified.
	 */
	public static final String LOWERCASE = "abcdefghijklmnopqrstuvwxyz";
	
	private final SortedSet<Character> symbols;
	
	private Alphabet(SortedSet<Character> symbols) {
		if (symbols.isEmpty())
			throw new IllegalArgumentException("Alphabet is empty");
		for (Character c : symbols) {
			if (c.charValue() == FiniteAutomaton.EPSILON)
				throw new IllegalArgumentException("Alphabet may not contain the epsilon symbol");
			if (OperatorTable.getDefault().isMetacharacter(c.charValue()))
				throw new IllegalArgumentException("Alphabet may not contain the metacharacter " + c);
		}
		this.symbols = Collections.unmodifiableSortedSet(symbols);
	}
	
	/**
	 * Parse an alphabet string given by a user.
	 * Every character must be a letter or digit. Duplicate
	 * characters are ignored.
	 * 
	 * @param s the alphabet string
	 * @return the Alphabet
	 * @throws IllegalArgumentException if the string is empty or contains a
	 *         character which isn't a letter or digit
	 */
	public static Alphabet parse(String s) {
		SortedSet<Character> symbols = new TreeSet<Character>();
		for (int i = 0; i < s.length(); ++i) {
			char c = s.charAt(i);
			if (!Character.isLetterOrDigit(c))
				throw new IllegalArgumentException("Alphabet symbol '" + c + "' is not a letter or digit");
			symbols.add(c);
		}
		return new Alphabet(symbols);
	}
	
	/**
	 * Create an alphabet from a collection of characters.
	 * 
	 * @param symbols the symbols
	 * @return the Alphabet
	 * @throws IllegalArgumentException if there are no symbols, or one of them is
	 *         the epsilon symbol or a metacharacter
	 */
	public static Alphabet of(Collection<Character> symbols) {
		return new Alphabet(new TreeSet<Character>(symbols));
	}
	
	/**
	 * @return the default alphabet (lowercase letters)
	 */
	public static Alphabet getDefault() {
		return parse(LOWERCASE);
	}
	
	public boolean contains(char c) {
		return symbols.contains(c);
	}
	
	public int size() {
		return symbols.size();
	}
	
	/**
	 * @return the symbols in ascending order
	 */
	public SortedSet<Character> getSymbols() {
		return symbols;
	}
	
	@Override
	public Iterator<Character> iterator() {
		return symbols.iterator();
	}
	
	@Override
	public boolean equals(Object obj) {
		if (obj == null || obj.getClass() != this.getClass())
			return false;
		return symbols.equals(((Alphabet) obj).symbols);
	}
	
	@Override
	public int hashCode() {
		return symbols.hashCode();
	}
	
	@Override
	public String toString() {
		StringBuilder buf = new StringBuilder();
		for (Character c : symbols)
			buf.append(c.charValue());
		return buf.toString();
	}
}
