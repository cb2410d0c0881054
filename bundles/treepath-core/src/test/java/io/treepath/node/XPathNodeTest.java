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

package io.treepath.node;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.treepath.node.builder.NodeTrees;
import io.treepath.node.builder.TreeSource;
import io.treepath.node.builder.XmlDocuments;
import io.treepath.xpath.types.Type;

public class XPathNodeTest {

  private ParentNode document;

  private ElementNode root;

  private CommentNode comment;

  private ProcessingInstructionNode pi;

  private ElementNode element;

  @BeforeEach
  public void setUp() {
    document = NodeTrees.build(TreeSource.of(
        XmlDocuments.parse("<r xmlns:q=\"u\" a=\"1\"><!--c--><?pi data?><q:e>t</q:e></r>")));
    root = (ElementNode) document.getChildren().get(0);
    comment = (CommentNode) root.getChildren().get(0);
    pi = (ProcessingInstructionNode) root.getChildren().get(1);
    element = (ElementNode) root.getChildren().get(2);
  }

  @Test
  public void testKinds() {
    assertEquals(NodeKind.DOCUMENT, document.getKind());
    assertEquals(NodeKind.ELEMENT, root.getKind());
    assertEquals(NodeKind.COMMENT, comment.getKind());
    assertEquals(NodeKind.PROCESSING_INSTRUCTION, pi.getKind());
    assertEquals(NodeKind.ATTRIBUTE, root.getAttributes().get(0).getKind());
    assertEquals(NodeKind.TEXT, element.getChildren().get(0).getKind());
  }

  @Test
  public void testPaths() {
    assertEquals("/", document.getPath());
    assertEquals("/r", root.getPath());
    assertEquals("/r/@a", root.getAttributes().get(0).getPath());
    assertEquals("/r/comment()", comment.getPath());
    assertEquals("/r/processing-instruction(pi)", pi.getPath());
    assertEquals("/r/q:e/text()", element.getChildren().get(0).getPath());
  }

  @Test
  public void testStringAndTypedValues() {
    assertEquals("t", root.getStringValue());
    assertEquals("c", comment.getStringValue());
    assertEquals("data", pi.getStringValue());
    assertEquals("pi", pi.getTarget());
    assertEquals(Type.STRING, comment.getTypedValue().get(0).getType());
    assertEquals(Type.STRING, pi.getTypedValue().get(0).getType());
    assertEquals(Type.UNTYPED_ATOMIC, element.getTypedValue().get(0).getType());
    assertEquals(Type.UNTYPED_ATOMIC, root.getAttributes().get(0).getTypedValue().get(0)
        .getType());
    assertEquals("1", root.getAttributes().get(0).getStringValue());
  }

  @Test
  public void testNames() {
    assertNull(document.getName());
    assertNull(comment.getName());
    assertEquals("u", element.getName().getNamespaceURI());
    assertEquals("q", element.getName().getPrefix());
    assertTrue(element.matchName("{u}e", null));
    assertTrue(element.matchName("{*}e", null));
    assertTrue(element.matchName("{u}*", null));
    assertTrue(element.matchName("*:e", null));
    assertTrue(element.matchName("*", null));
    assertFalse(element.matchName("e", null));
    assertTrue(element.matchName("e", "u"));
    assertTrue(root.getAttributes().get(0).matchName("a", "u"));
    assertTrue(pi.matchName("pi", null));
    assertFalse(comment.matchName("*", null));
  }

  @Test
  public void testNamespaceNodes() {
    final List<String> prefixes = new ArrayList<>();
    for (final NamespaceNode namespace : root.getNamespaceNodes()) {
      prefixes.add(namespace.getPrefix());
      if ("q".equals(namespace.getPrefix())) {
        assertEquals("u", namespace.getUri());
        assertEquals("u", namespace.getStringValue());
        assertSame(root, namespace.getParent());
      }
    }
    assertTrue(prefixes.contains("q"));
    assertTrue(prefixes.contains("xml"));
  }

  @Test
  public void testRootAndDocument() {
    final XPathNode text = element.getChildren().get(0);
    assertSame(document, text.getRoot());
    assertSame(document, text.getDocument());
    assertSame(document, document.getRoot());
  }

  @Test
  public void testDocumentOrder() {
    final List<XPathNode> nodes = new ArrayList<>(Arrays.asList(element, comment,
        root.getAttributes().get(0), document, pi, root));
    nodes.sort(XPathNode.DOCUMENT_ORDER);
    assertThat(nodes, contains(document, root, root.getAttributes().get(0), comment, pi,
        element));
  }

  @Test
  public void testIterDocument() {
    final List<NodeKind> kinds = new ArrayList<>();
    root.iterDocument().forEachRemaining(node -> kinds.add(node.getKind()));
    assertThat(kinds, contains(NodeKind.ELEMENT, NodeKind.NAMESPACE, NodeKind.NAMESPACE,
        NodeKind.ATTRIBUTE, NodeKind.COMMENT, NodeKind.PROCESSING_INSTRUCTION, NodeKind.ELEMENT,
        NodeKind.NAMESPACE, NodeKind.NAMESPACE, NodeKind.TEXT));
  }
}
