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

import static org.junit.Assert.assertEquals;
import static us.blanshard.deduce.core.Cells.BOARD_SIZE;
import static us.blanshard.deduce.core.Cells.POSSIBILITY_SIZE;
import static us.blanshard.deduce.core.Cells.ROW_COL_SEC_SIZE;

import com.google.common.collect.Sets;

import org.junit.Test;

import java.util.Set;

public class CellsTest {

  @Test public void sizes() {
    assertEquals(9, ROW_COL_SEC_SIZE);
    assertEquals(81, BOARD_SIZE);
    assertEquals(729, POSSIBILITY_SIZE);
  }

  @Test public void rowsAndColumns() {
    assertEquals(0, Cells.cellToRow(8));
    assertEquals(1, Cells.cellToRow(9));
    assertEquals(8, Cells.cellToColumn(80));
    assertEquals(4, Cells.cellToColumn(40));
    for (int cell = 0; cell < BOARD_SIZE; ++cell)
      assertEquals(cell, Cells.rowColumnToCell(Cells.cellToRow(cell), Cells.cellToColumn(cell)));
  }

  @Test public void sections() {
    assertEquals(0, Cells.cellToSection(20));
    assertEquals(2, Cells.cellToSection(8));
    assertEquals(4, Cells.cellToSection(40));
    assertEquals(6, Cells.cellToSection(72));
    assertEquals(8, Cells.cellToSection(80));
    assertEquals(30, Cells.cellToSectionStartCell(40));
    assertEquals(60, Cells.cellToSectionStartCell(80));
    assertEquals(33, Cells.sectionToFirstCell(5));
    assertEquals(54, Cells.sectionToFirstCell(6));
  }

  @Test public void sectionToCell() {
    assertEquals(30, Cells.sectionToCell(4, 0));
    assertEquals(32, Cells.sectionToCell(4, 2));
    assertEquals(39, Cells.sectionToCell(4, 3));
    assertEquals(50, Cells.sectionToCell(4, 8));

    Set<Integer> seen = Sets.newHashSet();
    for (int section = 0; section < ROW_COL_SEC_SIZE; ++section) {
      for (int offset = 0; offset < ROW_COL_SEC_SIZE; ++offset) {
        int cell = Cells.sectionToCell(section, offset);
        assertEquals(section, Cells.cellToSection(cell));
        seen.add(cell);
      }
    }
    assertEquals(BOARD_SIZE, seen.size());
  }

  @Test public void possibilityIndex() {
    assertEquals(0, Cells.possibilityIndex(0, 0));
    assertEquals(8, Cells.possibilityIndex(8, 0));
    assertEquals(9, Cells.possibilityIndex(0, 1));
    assertEquals(POSSIBILITY_SIZE - 1, Cells.possibilityIndex(8, 80));
  }
}
