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
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.StringReader;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import javax.xml.parsers.DocumentBuilderFactory;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.w3c.dom.Document;
import org.w3c.dom.Node;
import org.xml.sax.InputSource;

import io.treepath.XPathTestHelper;
import io.treepath.exception.XPathException;
import io.treepath.node.AttributeNode;
import io.treepath.node.DocumentNode;
import io.treepath.node.ElementNode;
import io.treepath.node.NodeKind;
import io.treepath.node.ParentNode;
import io.treepath.node.TextNode;
import io.treepath.node.XPathNode;

public class NodeTreesTest {

  private Document document;

  @BeforeEach
  public void setUp() {
    document = XPathTestHelper.createDocument();
  }

  @Test
  public void testDocumentPositions() {
    final ParentNode root = NodeTrees.build(TreeSource.of(document));
    assertThat(root, instanceOf(DocumentNode.class));
    assertEquals(1, root.getPosition());

    final ElementNode a = (ElementNode) root.getChildren().get(0);
    assertEquals(2, a.getPosition());
    // xml and p namespace nodes, then the attribute
    assertEquals(2, a.getNamespaceNodes().size());
    assertEquals(3, a.getNamespaceNodes().get(0).getPosition());
    assertEquals(4, a.getNamespaceNodes().get(1).getPosition());
    assertEquals(5, a.getAttributes().get(0).getPosition());

    final List<Integer> positions = new ArrayList<>();
    for (final XPathNode child : a.getChildren()) {
      positions.add(child.getPosition());
    }
    assertThat(positions, contains(6, 7, 14, 15, 23));
  }

  @Test
  public void testPositionsIncreaseInDocumentOrder() {
    final ParentNode root = NodeTrees.build(TreeSource.of(document));
    int last = 0;
    final Iterator<XPathNode> nodes = root.iterDocument();
    while (nodes.hasNext()) {
      final XPathNode node = nodes.next();
      assertTrue(node.getPosition() > last, node.getPath());
      last = node.getPosition();
    }
    assertEquals(23, last);
  }

  @Test
  public void testStringValues() {
    final ParentNode root = NodeTrees.build(TreeSource.of(document));
    assertEquals("oops1foooops2baroops3", root.getStringValue());
    final ElementNode a = (ElementNode) root.getChildren().get(0);
    assertThat(a.getChildren().get(0), instanceOf(TextNode.class));
    assertEquals("foo", a.getChildren().get(1).getStringValue());
    final AttributeNode x = ((ElementNode) a.getChildren().get(3)).getAttributes().get(0);
    assertEquals("y", x.getStringValue());
    assertEquals("ns", x.getName().getNamespaceURI());
  }

  @Test
  public void testTextMergedAcrossEntityReferences() throws Exception {
    final DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
    factory.setExpandEntityReferences(false);
    final Document unexpanded = factory.newDocumentBuilder().parse(new InputSource(
        new StringReader("<!DOCTYPE a [<!ENTITY e 'middle'>]><a>left &e; right<b/>tail</a>")));
    assertEquals(Node.ENTITY_REFERENCE_NODE,
        unexpanded.getDocumentElement().getChildNodes().item(1).getNodeType());

    final ParentNode root = NodeTrees.build(TreeSource.of(unexpanded));
    final ElementNode a = (ElementNode) root.getChildren().get(0);
    assertEquals(3, a.getChildren().size());
    assertThat(a.getChildren().get(0), instanceOf(TextNode.class));
    assertEquals("left middle right", a.getChildren().get(0).getStringValue());
    assertEquals("tail", a.getChildren().get(2).getStringValue());
  }

  @Test
  public void testParentLinks() {
    final ParentNode root = NodeTrees.build(TreeSource.of(document));
    final ElementNode a = (ElementNode) root.getChildren().get(0);
    final ElementNode b = (ElementNode) a.getChildren().get(1);
    assertSame(a, b.getParent());
    assertSame(root, a.getParent());
    assertSame(root, b.getRoot());
    assertSame(a, a.getAttributes().get(0).getParent());
    assertNull(root.getParent());
  }

  @Test
  public void testElementRootIsWrappedInDetachedDocument() {
    final ParentNode root = NodeTrees.build(TreeSource.of(document.getDocumentElement()),
        null, null, Boolean.FALSE);
    assertThat(root, instanceOf(DocumentNode.class));
    final DocumentNode detached = (DocumentNode) root;
    assertTrue(detached.isDetached());
    assertEquals(NodeKind.ELEMENT, detached.getDocumentElement().getKind());
    assertNull(detached.getDocumentElement().getParent());
  }

  @Test
  public void testElementRootKeepsStructure() {
    final ParentNode root = NodeTrees.build(TreeSource.of(document.getDocumentElement()));
    assertThat(root, instanceOf(ElementNode.class));
    assertEquals(1, root.getPosition());
    assertNull(root.getDocument());
  }

  @Test
  public void testFragmentOfDocument() {
    final ParentNode root =
        NodeTrees.build(TreeSource.of(document), null, "test.xml", Boolean.TRUE);
    assertThat(root, instanceOf(ElementNode.class));
    assertThat(root.getTree().getUri(), is("test.xml"));
  }

  @Test
  public void testTreesAreOrderedByCreation() {
    final ParentNode first = NodeTrees.build(TreeSource.of(document));
    final ParentNode second = NodeTrees.build(TreeSource.of(document));
    assertTrue(first.getTree().getTreeId() < second.getTree().getTreeId());
    final XPathNode lastOfFirst = first.getChildren().get(0).getChildren().get(4);
    assertTrue(XPathNode.DOCUMENT_ORDER.compare(lastOfFirst, second) < 0);
  }

  @Test
  public void testInvalidRoot() {
    assertThrows(XPathException.class, () -> TreeSource.fromObject("<a/>"));
  }

  @Test
  public void testMalformedXml() {
    assertThrows(XPathException.class, () -> XmlDocuments.parse("<a><b></a>"));
  }
}
