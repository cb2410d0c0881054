/**
 * Copyright (c) 2011, University of Konstanz, Distributed Systems Group All rights reserved.
 * 
 * Redistribution and use in source and binary forms, with or without modification, are permitted
 * provided that the following conditions are met: * Redistributions of source code must retain the
 * above copyright notice, this list of conditions and the following disclaimer. * Redistributions
 * in binary form must reproduce the above copyright notice, this list of conditions and the
 * following disclaimer in the documentation and/or other materials provided with the distribution.
 * * Neither the name of the University of Konstanz nor the names of its contributors may be used to
 * endorse or promote products derived from this software without specific prior written permission.
 * 
 * THIS SOFTWARE IS PROVIDED BY THE COPYRIGHT HOLDERS AND CONTRIBUTORS "AS IS" AND ANY EXPRESS OR
 * IMPLIED WARRANTIES, INCLUDING, BUT NOT LIMITED TO, THE IMPLIED WARRANTIES OF MERCHANTABILITY AND
 * FITNESS FOR A PARTICULAR PURPOSE ARE DISCLAIMED. IN NO EVENT SHALL <COPYRIGHT HOLDER> BE LIABLE
 * FOR ANY DIRECT, INDIRECT, INCIDENTAL, SPECIAL, EXEMPLARY, OR CONSEQUENTIAL DAMAGES (INCLUDING,
 * BUT NOT LIMITED TO, PROCUREMENT OF SUBSTITUTE GOODS OR SERVICES; LOSS OF USE, DATA, OR PROFITS;
 * OR BUSINESS INTERRUPTION) HOWEVER CAUSED AND ON ANY THEORY OF LIABILITY, WHETHER IN CONTRACT,
 * STRICT LIABILITY, OR TORT (INCLUDING NEGLIGENCE OR OTHERWISE) ARISING IN ANY WAY OUT OF THE USE
 * OF THIS SOFTWARE, EVEN IF ADVISED OF THE POSSIBILITY OF SUCH DAMAGE.
 */

package io.treepath.node.builder;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.treepath.node.SchemaElementNode;
import io.treepath.node.XPathNode;
import io.treepath.schema.TestSchema;

public class SchemaNodeTreeBuilderTest {

  private TestSchema schema;

  @BeforeEach
  public void setUp() {
    schema = new TestSchema();
  }

  private static List<String> localNames(final List<XPathNode> nodes) {
    final List<String> names = new ArrayList<>();
    for (final XPathNode node : nodes) {
      names.add(node.getName().getLocalPart());
    }
    return names;
  }

  @Test
  public void testSchemaRoot() {
    final SchemaNodeTreeBuilder builder = new SchemaNodeTreeBuilder(null);
    final SchemaElementNode root = builder.build(schema);
    assertEquals(SchemaNodeTreeBuilder.SCHEMA_ROOT_NAME, root.getName());
    assertThat(localNames(root.getChildren()), contains("root", "note"));
    assertEquals("test.xsd", root.getTree().getUri());
    assertEquals(2, builder.getGlobalElements().size());
  }

  @Test
  public void testContentModel() {
    final SchemaElementNode root = new SchemaNodeTreeBuilder(null).build(schema);
    final XPathNode element = root.getChildren().get(0);
    assertThat(localNames(element.getChildren()), contains("item", "note"));
    assertThat(localNames(element.getChildren().get(0).getChildren()), contains("name"));
    assertEquals("id",
        ((SchemaElementNode) element).getAttributes().get(0).getName().getLocalPart());
  }

  @Test
  public void testReferenceIsLinkedToGlobalDeclaration() {
    final SchemaElementNode root = new SchemaNodeTreeBuilder(null).build(schema);
    final SchemaElementNode reference =
        (SchemaElementNode) root.getChildren().get(0).getChildren().get(1);
    final SchemaElementNode global = (SchemaElementNode) root.getChildren().get(1);
    assertSame(global, reference.getRef());
    assertEquals(global.getChildren(), reference.getChildren());
  }

  @Test
  public void testElementDeclarationRoot() {
    final SchemaElementNode root = new SchemaNodeTreeBuilder("root.xsd").build(schema.getRoot());
    assertSame(schema.getRoot(), root.getDeclaration());
    assertEquals(1, root.getPosition());
    assertThat(localNames(root.getChildren()), contains("item", "note"));
  }

  @Test
  public void testPositionsAreUnique() {
    final SchemaElementNode root = new SchemaNodeTreeBuilder(null).build(schema);
    int last = 0;
    for (final XPathNode node : root.getChildren()) {
      assertTrue(node.getPosition() > last);
      last = node.getPosition();
    }
  }

  @Test
  public void testSchemaNodesHaveSampleValues() {
    final SchemaElementNode root = new SchemaNodeTreeBuilder(null).build(schema);
    assertEquals("1", root.getChildren().get(0).getTypedValue().get(0).getStringValue());
  }

  @Test
  public void testRecursiveDeclarationIsBuiltOnce() {
    final SchemaElementNode section =
        new SchemaNodeTreeBuilder(null).build(TestSchema.recursiveDeclaration());
    assertEquals(1, section.getChildren().size());
    final SchemaElementNode nested = (SchemaElementNode) section.getChildren().get(0);
    assertSame(section.getDeclaration(), nested.getDeclaration());
    assertEquals(section.getChildren(), nested.getChildren());
  }
}
