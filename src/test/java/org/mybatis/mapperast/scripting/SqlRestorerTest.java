/*
 *    Copyright 2009-2021 the original author or authors.
 *
 *    Licensed under the Apache License, Version 2.0 (the "License");
 *    you may not use this file except in compliance with the License.
 *    You may obtain a copy of the License at
 *
 *       http://www.apache.org/licenses/LICENSE-2.0
 *
 *    Unless required by applicable law or agreed to in writing, software
 *    distributed under the License is distributed on an "AS IS" BASIS,
 *    WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *    See the License for the specific language governing permissions and
 *    limitations under the License.
 */
package org.mybatis.mapperast.scripting;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.io.Reader;
import java.util.Arrays;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.mybatis.mapperast.builder.xml.XMLMapperBuilder;
import org.mybatis.mapperast.io.Resources;
import org.mybatis.mapperast.scripting.xmltags.RootNode;
import org.mybatis.mapperast.session.Configuration;

class SqlRestorerTest {

  private final SqlRestorer restorer = new SqlRestorer();

  @Test
  void shouldReplaceBindPlaceholdersWithParameterMarkers() {
    RootNode root = XMLMapperBuilder.parse(
        "<mapper namespace=\"m\"><select id=\"s\">SELECT * FROM t WHERE id = #{id} AND name = #{name,jdbcType=VARCHAR}"
            + "</select></mapper>");
    assertEquals("SELECT * FROM t WHERE id = ? AND name = ?", restorer.restore(root.getChildren().get(0).getChildren().get(0)));
  }

  @Test
  void shouldInlineSubstitutionPlaceholders() {
    RootNode root = XMLMapperBuilder.parse("<select id=\"s\">SELECT * FROM ${ table } ORDER BY ${col}</select>");
    assertEquals("SELECT * FROM table ORDER BY col", restorer.restore(root));
  }

  @Test
  void shouldTakeFirstChooseBranchAndAllIfContents() {
    RootNode root = XMLMapperBuilder.parse("<select id=\"s\">SELECT * FROM blog WHERE state = 'ACTIVE'"
        + "<choose><when test=\"title != null\">AND title like #{title}</when>"
        + "<otherwise>AND featured = 1</otherwise></choose>"
        + "<if test=\"orderBy != null\">ORDER BY ${orderBy}</if></select>");
    assertEquals("SELECT * FROM blog WHERE state = 'ACTIVE' AND title like ? ORDER BY orderBy", restorer.restore(root));
  }

  @Test
  void shouldRestoreEveryStatementOfAMapper() throws Exception {
    RootNode root;
    try (Reader reader = Resources.getResourceAsReader("org/mybatis/mapperast/builder/xml/BlogMapper.xml")) {
      root = new XMLMapperBuilder(reader, new Configuration(), "BlogMapper.xml").parse();
    }

    Map<String, String> statements = restorer.restoreStatements(root);
    String ns = "org.apache.ibatis.domain.blog.mappers.BlogMapper.";
    assertEquals(Arrays.asList(ns + "selectBlog", ns + "findActiveBlogLike", ns + "insertBlog", ns + "updateBlog",
        ns + "deleteBlog"), Arrays.asList(statements.keySet().toArray(new String[0])));
    assertEquals("SELECT * FROM blog WHERE id = ?", statements.get(ns + "selectBlog"));
    assertEquals("SELECT * FROM blog WHERE state = 'ACTIVE' AND title like ? ORDER BY orderBy",
        statements.get(ns + "findActiveBlogLike"));
    assertEquals("INSERT INTO blog (title, author_id) VALUES (?, ?)", statements.get(ns + "insertBlog"));
    assertEquals("UPDATE blog SET title = ?", statements.get(ns + "updateBlog"));
    assertEquals("DELETE FROM blog WHERE id = ? AND views < 10", statements.get(ns + "deleteBlog"));
  }

  @Test
  void shouldKeepFirstOfDuplicateStatements() {
    RootNode root = XMLMapperBuilder.parse("<mapper namespace=\"m\">"
        + "<select id=\"s\">SELECT 1</select><select id=\"s\">SELECT 2</select></mapper>");
    Map<String, String> statements = restorer.restoreStatements(root);
    assertEquals(1, statements.size());
    assertEquals("SELECT 1", statements.get("m.s"));
  }

  @Test
  void shouldKeyStatementsOutsideMapperById() {
    RootNode root = XMLMapperBuilder.parse("<select id=\"s\">SELECT 1</select>");
    assertEquals("SELECT 1", restorer.restoreStatements(root).get("s"));
  }

}
