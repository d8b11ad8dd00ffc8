/*
Copyright 2013 Luke Blanshard

Licensed under the Apache License, Version 2.0 (the "License");
you may not use this file except in compliance with the License.
You may obtain a copy of the License at

     http://www.apache.org/licenses/LICENSE-2.0

Unless required by applicable law or agreed to in writing, software
distributed under the License is distributed on an "AS IS" BASIS,
WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
See the License for the specific language governing permissions and
limitations under the License.
*/
package us.blanshard.deduce.core;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.Test;

public class GridTest {

  static final String SOLVED =
      "174385962293467158586192734451923876928674315367851249719548623635219487842736591";
  static final String PUZZLE =
      "1.......2.9.4...5...6...7...5.9.3.......7.......85..4.7.....6...3...9.8...2.....1";

  @Test public void fromString() {
    Grid grid = Grid.fromString(PUZZLE);
    assertEquals(1, grid.get(0));
    assertEquals(0, grid.get(1));
    assertEquals(2, grid.get(8));
    assertEquals(1, grid.get(80));
    assertEquals(21, grid.size());
    assertEquals(PUZZLE, grid.toFlatString());
  }

  @Test public void fromString_ignoresLayout() {
    Grid grid = Grid.fromString(Grid.fromString(PUZZLE).toString());
    assertEquals(Grid.fromString(PUZZLE), grid);
  }

  @Test public void fromString_zeroIsBlank() {
    assertEquals(Grid.fromString(PUZZLE), Grid.fromString(PUZZLE.replace('.', '0')));
  }

  @Test(expected = IllegalArgumentException.class)
  public void fromString_tooShort() {
    Grid.fromString(PUZZLE.substring(1));
  }

  @Test(expected = IllegalArgumentException.class)
  public void fromString_tooLong() {
    Grid.fromString(PUZZLE + "5");
  }

  @Test public void of() {
    int[] values = Grid.fromString(SOLVED).toArray();
    Grid grid = Grid.of(values);
    assertEquals(SOLVED, grid.toFlatString());
    values[0] = 9;
    assertEquals(1, grid.get(0));
  }

  @Test public void of_badValues() {
    try {
      Grid.of(new int[80]);
      fail();
    } catch (IllegalArgumentException expected) {}
    int[] values = new int[81];
    values[3] = 10;
    try {
      Grid.of(values);
      fail();
    } catch (IllegalArgumentException expected) {}
  }

  @Test public void states() {
    assertEquals(Grid.State.INCOMPLETE, Grid.BLANK.getState());
    assertEquals(Grid.State.INCOMPLETE, Grid.fromString(PUZZLE).getState());
    assertEquals(Grid.State.SOLVED, Grid.fromString(SOLVED).getState());
    assertTrue(Grid.fromString(SOLVED).isSolved());

    Grid broken = Grid.fromString(SOLVED).toBuilder().put(1, 1).build();
    assertEquals(Grid.State.BROKEN, broken.getState());
    assertFalse(broken.isSolved());

    Grid sectionClash = Grid.builder().put(0, 5).put(10, 5).build();
    assertEquals(Grid.State.BROKEN, sectionClash.getState());
  }

  @Test public void builder() {
    Grid.Builder builder = Grid.builder();
    builder.put(40, 5).put(0, 1);
    assertEquals(2, builder.size());
    assertEquals(5, builder.get(40));
    Grid first = builder.build();
    builder.remove(40);
    Grid second = builder.build();
    assertNotSame(first, second);
    assertEquals(5, first.get(40));
    assertEquals(0, second.get(40));
    assertTrue(second.isSet(0));
    assertEquals(Grid.BLANK, builder.clear().build());
  }

  @Test public void toStringLayout() {
    String s = Grid.fromString(SOLVED).toString();
    assertThat(s).startsWith(" 1 7 4 | 3 8 5 | 9 6 2\n");
    assertThat(s).contains("-------+-------+-------\n");
    assertEquals(11, s.split("\n").length);
  }

  @Test public void equalsAndHashCode() {
    assertEquals(Grid.fromString(PUZZLE), Grid.fromString(PUZZLE));
    assertEquals(Grid.fromString(PUZZLE).hashCode(), Grid.fromString(PUZZLE).hashCode());
    assertFalse(Grid.fromString(PUZZLE).equals(Grid.BLANK));
  }
}
