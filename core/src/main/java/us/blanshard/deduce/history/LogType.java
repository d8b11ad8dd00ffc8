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
package us.blanshard.deduce.history;

/**
 * The kinds of step recorded while solving a puzzle: the givens, each
 * deduction technique, guesses, and the rollbacks of failed guesses.
 *
 * @author Luke Blanshard
 */
public enum LogType {
  GIVEN("Mark given"),
  SINGLE("Mark only possibility for cell"),
  HIDDEN_SINGLE_ROW("Mark single possibility for value in row"),
  HIDDEN_SINGLE_COLUMN("Mark single possibility for value in column"),
  HIDDEN_SINGLE_SECTION("Mark single possibility for value in section"),
  GUESS("Mark guess (start round)"),
  ROLLBACK("Roll back round"),
  NAKED_PAIR_ROW("Remove possibilities for naked pair in row"),
  NAKED_PAIR_COLUMN("Remove possibilities for naked pair in column"),
  NAKED_PAIR_SECTION("Remove possibilities for naked pair in section"),
  POINTING_PAIR_TRIPLE_ROW(
      "Remove possibilities for row because all values are in one section"),
  POINTING_PAIR_TRIPLE_COLUMN(
      "Remove possibilities for column because all values are in one section"),
  ROW_BOX("Remove possibilities for section because all values are in one row"),
  COLUMN_BOX("Remove possibilities for section because all values are in one column"),
  HIDDEN_PAIR_ROW("Remove possibilities from hidden pair in row"),
  HIDDEN_PAIR_COLUMN("Remove possibilities from hidden pair in column"),
  HIDDEN_PAIR_SECTION("Remove possibilities from hidden pair in section");

  private final String description;

  private LogType(String description) {
    this.description = description;
  }

  public String getDescription() {
    return description;
  }
}
