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

import static org.hamcrest.CoreMatchers.equalTo;
import static org.hamcrest.CoreMatchers.not;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;

import java.util.BitSet;
import java.util.HashMap;
import java.util.Map;

import org.junit.Test;

public class StateSetTest {
	@Test
	public void testOrderDoesNotMatter() {
		StateSet s1 = StateSet.of(3, 1, 2);
		StateSet s2 = StateSet.of(1, 2, 3, 2);
		assertThat(s1, equalTo(s2));
		assertThat(s1.hashCode(), equalTo(s2.hashCode()));
		
		Map<StateSet, Integer> map = new HashMap<StateSet, Integer>();
		map.put(s1, 7);
		assertThat(map.get(s2), equalTo(7));
	}
	
	@Test
	public void testMembers() {
		StateSet s = StateSet.of(9, 1);
		assertThat(s.size(), equalTo(2));
		assertTrue(s.contains(1));
		assertTrue(s.contains(9));
		assertThat(s.toArray()[0], equalTo(1));
		assertThat(s.toArray()[1], equalTo(9));
		assertThat(s, not(equalTo(StateSet.of(1))));
	}
	
	@Test
	public void testImmutable() {
		BitSet bits = new BitSet();
		bits.set(4);
		StateSet s = new StateSet(bits);
		bits.set(5);
		assertThat(s, equalTo(StateSet.of(4)));
	}
}
