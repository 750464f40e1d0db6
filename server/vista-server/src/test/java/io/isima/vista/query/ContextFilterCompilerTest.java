/*
 * Copyright (C) 2025 Isima, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.isima.vista.query;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.containsString;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.fail;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.isima.vista.TestTrees;
import io.isima.vista.errors.exception.InvalidFilterException;
import io.isima.vista.field.FieldResolver;
import io.isima.vista.models.context.ContextParser;
import io.isima.vista.models.context.DataContext;
import io.isima.vista.tree.DataTree;
import io.isima.vista.tree.TreeRow;
import io.isima.vista.utils.VistaObjectMapperProvider;
import java.util.ArrayList;
import java.util.List;
import org.junit.BeforeClass;
import org.junit.Test;

public class ContextFilterCompilerTest {
  private static ObjectMapper mapper;
  private static DataTree tree;
  private static ContextFilterCompiler compiler;

  @BeforeClass
  public static void setUpBeforeClass() {
    mapper = VistaObjectMapperProvider.get();
    tree = TestTrees.employees();
    compiler = new ContextFilterCompiler(tree, new FieldResolver(false));
  }

  @Test
  public void testEmptyContext() throws Exception {
    assertNull(compiler.compile(null));
    assertNull(compiler.compile(DataContext.empty()));
  }

  @Test
  public void testComparisons() throws Exception {
    assertThat(select("{'field': 6, 'operator': 'gt', 'value': 30}"), contains(3, 4, 5));
    assertThat(select("{'field': 6, 'operator': 'gte', 'value': 31}"), contains(3, 4, 5));
    assertThat(select("{'field': 6, 'operator': 'lt', 'value': 26}"), contains(1));
    assertThat(select("{'field': 6, 'operator': 'lte', 'value': '26'}"), contains(1, 2));
    assertThat(select("{'field': 6, 'operator': 'range', 'value': [26, 35]}"), contains(2, 3, 4));
    assertThat(
        select("{'field': 6, 'operator': '-range', 'value': [26, 35]}"), contains(1, 5, 6));
  }

  @Test
  public void testEquality() throws Exception {
    assertThat(
        select("{'field': 'employee.last_name', 'operator': 'exact', 'value': 'Smith'}"),
        contains(1, 2));
    assertThat(
        select("{'field': 5, 'operator': '-exact', 'value': 'Smith'}"), contains(3, 4, 5, 6));
    assertThat(select("{'field': 7, 'operator': 'exact', 'value': true}"), contains(3, 5));
    assertThat(
        select("{'field': 1, 'operator': 'in', 'value': ['QA', 'CEO']}"), contains(3, 5));
    assertThat(
        select("{'field': 1, 'operator': '-in', 'value': ['QA', 'CEO']}"), contains(1, 2, 4, 6));
  }

  @Test
  public void testNullsAndText() throws Exception {
    assertThat(select("{'field': 6, 'operator': 'isnull', 'value': true}"), contains(6));
    assertThat(select("{'field': 3, 'operator': 'isnull', 'value': true}"), contains(6));
    assertThat(select("{'field': 3, 'operator': 'icontains', 'value': 'YORK'}"), contains(3, 4));
    assertThat(
        select("{'field': 3, 'operator': '-icontains', 'value': 'york'}"), contains(1, 2, 5, 6));
  }

  @Test
  public void testBranches() throws Exception {
    final String or =
        "{'type': 'or', 'children': ["
            + "{'field': 6, 'operator': 'lt', 'value': 25},"
            + "{'field': 1, 'operator': 'exact', 'value': 'CEO'}]}";
    assertThat(select(or), containsInAnyOrder(1, 5));

    final String and =
        "{'type': 'and', 'children': ["
            + "{'field': 3, 'operator': 'exact', 'value': 'Chicago'},"
            + "{'type': 'or', 'children': ["
            + "  {'field': 7, 'operator': 'exact', 'value': true},"
            + "  {'field': 6, 'operator': 'gt', 'value': 25}]}]}";
    assertThat(select(and), contains(2, 5));
  }

  @Test
  public void testUnknownField() throws Exception {
    try {
      select("{'field': 'employee.salary', 'operator': 'exact', 'value': 1}");
      fail("exception must be thrown");
    } catch (InvalidFilterException e) {
      assertThat(e.getMessage(), containsString("employee.salary"));
    }
  }

  @Test(expected = InvalidFilterException.class)
  public void testUnreachableField() throws Exception {
    select("{'field': 8, 'operator': 'exact', 'value': 'Vista'}");
  }

  @Test(expected = InvalidFilterException.class)
  public void testOperandTypeMismatch() throws Exception {
    select("{'field': 6, 'operator': 'gt', 'value': 'thirty'}");
  }

  private static List<Integer> select(String src) throws Exception {
    final var context = ContextParser.parse(mapper.readTree(src.replace("'", "\"")));
    final var predicate = compiler.compile(context);
    final List<Integer> pks = new ArrayList<>();
    for (TreeRow row : QuerySet.all(tree).filter(predicate)) {
      pks.add((Integer) row.getPk());
    }
    return pks;
  }
}
