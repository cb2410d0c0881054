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

import static java.util.Objects.requireNonNull;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import javax.xml.XMLConstants;
import javax.xml.namespace.QName;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Attr;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;
import org.w3c.dom.ProcessingInstruction;

import io.treepath.node.AttributeData;
import io.treepath.node.CommentNode;
import io.treepath.node.DocumentNode;
import io.treepath.node.ElementNode;
import io.treepath.node.NodeTree;
import io.treepath.node.ParentNode;
import io.treepath.node.ProcessingInstructionNode;
import io.treepath.node.TextNode;
import io.treepath.utils.LogWrapper;
import io.treepath.xpath.EXPathError;

/**
 * <h1>DomNodeTreeBuilder</h1>
 * <p>
 * Builds a node tree from a DOM document or element in one iterative depth-first traversal. Every
 * element takes the positions following its own for its namespace and attribute nodes, every
 * text, comment and processing instruction takes one position. Adjacent text and CDATA sections
 * are merged into one text node, also across unexpanded entity references. Document type
 * declarations are skipped.
 * </p>
 */
final class DomNodeTreeBuilder {

  /** {@link LogWrapper} reference. */
  private static final LogWrapper LOGWRAPPER =
      new LogWrapper(LoggerFactory.getLogger(DomNodeTreeBuilder.class));

  /** The DOM document or element. */
  private final Node root;

  /** Namespace map of the tree. */
  private final Map<String, String> namespaces;

  /** URI of the source. */
  private final @Nullable String uri;

  /** Fragment mode. */
  private final @Nullable Boolean fragment;

  /** Next free position. */
  private int position = 1;

  /** Number of created nodes, for diagnostics. */
  private int nodeCount;

  /** Text not yet written to a text node. */
  private final StringBuilder pendingText = new StringBuilder();

  /** Parent of the pending text. */
  private @Nullable ParentNode pendingParent;

  /** Traversal state of one parent node. */
  private static final class Frame {
    /** The parent node the children are appended to. */
    final ParentNode parent;

    /** In-scope namespaces of the children. */
    final Map<String, String> namespaces;

    /** Next DOM child to visit. */
    @Nullable
    Node next;

    /** Whether the children are the replacement content of an entity reference. */
    final boolean entity;

    Frame(final ParentNode parent, final @Nullable Node next,
        final Map<String, String> namespaces) {
      this(parent, next, namespaces, false);
    }

    Frame(final ParentNode parent, final @Nullable Node next,
        final Map<String, String> namespaces, final boolean entity) {
      this.parent = parent;
      this.next = next;
      this.namespaces = namespaces;
      this.entity = entity;
    }
  }

  /**
   * Constructor.
   *
   * @param root the DOM document or element
   * @param namespaces namespace map of the tree
   * @param uri URI of the source or {@code null}
   * @param fragment fragment mode or {@code null}
   */
  DomNodeTreeBuilder(final Node root, final Map<String, String> namespaces,
      final @Nullable String uri, final @Nullable Boolean fragment) {
    this.root = requireNonNull(root);
    this.namespaces = requireNonNull(namespaces);
    this.uri = uri;
    this.fragment = fragment;
  }

  /**
   * Builds the tree.
   *
   * @return the root node
   */
  ParentNode build() {
    Document document = root instanceof Document domDocument ? domDocument : null;
    final Element rootElement =
        document != null ? document.getDocumentElement() : (Element) root;

    if (Boolean.TRUE.equals(fragment)) {
      if (rootElement == null) {
        throw EXPathError.XPTY0004.newException("requested a fragment of an empty document");
      }
      document = null;
    } else if (fragment == null && document == null && hasDocumentSiblings(rootElement)) {
      // keep the comments and processing instructions around the document element
      document = rootElement.getOwnerDocument();
    }

    final NodeTree tree = new NodeTree(namespaces, uri);
    final Deque<Frame> stack = new ArrayDeque<>();
    final ParentNode result;
    if (document != null) {
      final DocumentNode documentNode = new DocumentNode(tree, position++);
      nodeCount++;
      stack.push(new Frame(documentNode, document.getFirstChild(), namespaces));
      result = documentNode;
    } else {
      final ElementNode element = createElement(tree, null, rootElement, namespaces);
      stack.push(new Frame(element, rootElement.getFirstChild(), element.getNamespaces()));
      result = element;
    }

    traverse(tree, stack);
    LOGWRAPPER.debug("Built node tree {} of {} nodes, last position {}.", tree.getTreeId(),
        nodeCount, position - 1);

    if (Boolean.FALSE.equals(fragment) && result instanceof ElementNode element) {
      return DocumentNode.detached(element);
    }
    return result;
  }

  private static boolean hasDocumentSiblings(final Element element) {
    if (!(element.getParentNode() instanceof Document)) {
      return false;
    }
    for (Node sibling = element.getParentNode().getFirstChild(); sibling != null;
        sibling = sibling.getNextSibling()) {
      final short nodeType = sibling.getNodeType();
      if (nodeType == Node.COMMENT_NODE || nodeType == Node.PROCESSING_INSTRUCTION_NODE) {
        return true;
      }
    }
    return false;
  }

  private void traverse(final NodeTree tree, final Deque<Frame> stack) {
    while (!stack.isEmpty()) {
      final Frame frame = stack.peek();
      final Node node = frame.next;
      if (node == null) {
        stack.pop();
        if (!frame.entity) {
          flushText(tree);
        }
        continue;
      }
      frame.next = node.getNextSibling();

      switch (node.getNodeType()) {
        case Node.ELEMENT_NODE -> {
          flushText(tree);
          final ElementNode element =
              createElement(tree, frame.parent, (Element) node, frame.namespaces);
          if (node.hasChildNodes()) {
            stack.push(new Frame(element, node.getFirstChild(), element.getNamespaces()));
          }
        }
        case Node.TEXT_NODE, Node.CDATA_SECTION_NODE -> {
          pendingText.append(node.getNodeValue());
          pendingParent = frame.parent;
        }
        case Node.COMMENT_NODE -> {
          flushText(tree);
          new CommentNode(tree, frame.parent, position++, node.getNodeValue());
          nodeCount++;
        }
        case Node.PROCESSING_INSTRUCTION_NODE -> {
          flushText(tree);
          final ProcessingInstruction instruction = (ProcessingInstruction) node;
          new ProcessingInstructionNode(tree, frame.parent, position++, instruction.getTarget(),
              instruction.getData());
          nodeCount++;
        }
        case Node.ENTITY_REFERENCE_NODE ->
          // unexpanded entity references contribute their replacement content
          stack.push(new Frame(frame.parent, node.getFirstChild(), frame.namespaces, true));
        default -> LOGWRAPPER.debug("Skipped DOM node {}.", node.getNodeName());
      }
    }
    flushText(tree);
  }

  /**
   * Writes the text collected since the last non-text node, merging adjacent text, CDATA
   * sections and the text of entity references in between.
   */
  private void flushText(final NodeTree tree) {
    if (pendingParent == null) {
      return;
    }
    if (pendingText.length() > 0) {
      new TextNode(tree, pendingParent, position++, pendingText.toString());
      nodeCount++;
    }
    pendingText.setLength(0);
    pendingParent = null;
  }

  private ElementNode createElement(final NodeTree tree, final @Nullable ParentNode parent,
      final Element element, final Map<String, String> inherited) {
    Map<String, String> inScope = inherited;
    final List<AttributeData> attributes = new ArrayList<>();
    final NamedNodeMap domAttributes = element.getAttributes();
    for (int i = 0, length = domAttributes.getLength(); i < length; i++) {
      final Attr attribute = (Attr) domAttributes.item(i);
      if (XMLConstants.XMLNS_ATTRIBUTE_NS_URI.equals(attribute.getNamespaceURI())
          || attribute.getLocalName() == null && isNamespaceDeclaration(attribute.getName())) {
        if (inScope == inherited) {
          inScope = new LinkedHashMap<>(inherited);
        }
        final String prefix = XMLConstants.XMLNS_ATTRIBUTE.equals(attribute.getName()) ? ""
            : attribute.getName().substring(XMLConstants.XMLNS_ATTRIBUTE.length() + 1);
        if (prefix.isEmpty() && attribute.getValue().isEmpty()) {
          inScope.remove(prefix);
        } else {
          inScope.put(prefix, attribute.getValue());
        }
      } else {
        attributes.add(new AttributeData(nameOf(attribute), attribute.getValue(), null));
      }
    }

    final ElementNode node =
        new ElementNode(tree, parent, position, nameOf(element), inScope, attributes, null);
    position += ElementNode.getReservedPositions(inScope, attributes.size());
    nodeCount += 1 + attributes.size();
    return node;
  }

  private static boolean isNamespaceDeclaration(final String name) {
    return XMLConstants.XMLNS_ATTRIBUTE.equals(name)
        || name.startsWith(XMLConstants.XMLNS_ATTRIBUTE + ':');
  }

  private static QName nameOf(final Node node) {
    final String localName = node.getLocalName();
    if (localName == null) {
      return new QName(node.getNodeName());
    }
    final String namespace = node.getNamespaceURI();
    final String prefix = node.getPrefix();
    return new QName(namespace == null ? XMLConstants.NULL_NS_URI : namespace, localName,
        prefix == null ? XMLConstants.DEFAULT_NS_PREFIX : prefix);
  }
}
