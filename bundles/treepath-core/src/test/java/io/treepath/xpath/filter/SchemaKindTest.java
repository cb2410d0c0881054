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

package io.treepath.xpath.filter;

import static io.treepath.XPathTestHelper.paths;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.w3c.dom.Document;

import io.treepath.exception.XPathException;
import io.treepath.node.builder.XmlDocuments;
import io.treepath.schema.TestSchema;
import io.treepath.xpath.XPathSelector;
import io.treepath.xpath.parser.ParserConfiguration;

public class SchemaKindTest {

  private static final String XML =
      "<p:root xmlns:p=\"ns\" id=\"1\"><item><name>x</name></item><p:note/></p:root>";

  private ParserConfiguration config;

  private Document document;

  @BeforeEach
  public void setUp() {
    config = new ParserConfiguration.Builder().namespaces(TestSchema.NAMESPACE_MAP)
        .schema(new TestSchema()).build();
    document = XmlDocuments.parse(XML);
  }

  @Test
  public void testSchemaElement() {
    assertThat(paths(new XPathSelector("/schema-element(p:root)", config).select(document)),
        contains("/p:root"));
    assertThat(paths(new XPathSelector("//schema-element(p:note)", config).select(document)),
        contains("/p:root/p:note"));
    assertThat(paths(new XPathSelector("/p:root/item/name", config).select(document)),
        contains("/p:root/item/name"));
  }

  @Test
  public void testSchemaAttribute() {
    assertThat(paths(new XPathSelector("/p:root/attribute::schema-attribute(id)", config)
        .select(document)), contains("/p:root/@id"));
  }

  @Test
  public void testUndeclaredNames() {
    final XPathException element = assertThrows(XPathException.class,
        () -> new XPathSelector("//schema-element(p:missing)", config));
    assertEquals("XPST0008", element.getCode());
    final XPathException attribute = assertThrows(XPathException.class,
        () -> new XPathSelector("//@schema-attribute(missing)", config));
    assertEquals("XPST0008", attribute.getCode());
  }

  @Test
  public void testWithoutSchema() {
    final ParserConfiguration plain =
        new ParserConfiguration.Builder().namespaces(TestSchema.NAMESPACE_MAP).build();
    assertThrows(XPathException.class,
        () -> new XPathSelector("//schema-element(p:root)", plain));
  }

  @Test
  public void testStaticCheckAgainstSchemaGraph() {
    final XPathException e = assertThrows(XPathException.class,
        () -> new XPathSelector("/p:root/item + 'a'", config));
    assertEquals("XPTY0004", e.getCode());
  }
}
