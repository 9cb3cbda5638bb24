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

package io.xmltree.service.xml.serialize;

import io.xmltree.node.CData;
import io.xmltree.node.Comment;
import io.xmltree.node.EntityReference;
import io.xmltree.node.Node;
import io.xmltree.node.ProcessingInstruction;
import io.xmltree.node.Text;
import io.xmltree.settings.CharsForSerializing;
import io.xmltree.utils.XMLToken;
import java.io.IOException;
import java.io.Writer;

/**
 * Default {@link NodeRenderer}. Text is escaped, everything else is written literally.
 *
 */
public final class DefaultNodeRenderer implements NodeRenderer {

  @Override
  public void render(final Node node, final Writer out) throws IOException {
    switch (node.getKind()) {
      case TEXT -> out.write(XMLToken.escapeContent(((Text) node).text()));
      case CDATA -> {
        out.write(CharsForSerializing.OPENCDATA.getValue());
        out.write(((CData) node).text());
        out.write(CharsForSerializing.CLOSECDATA.getValue());
      }
      case COMMENT -> {
        out.write(CharsForSerializing.OPENCOMMENT.getValue());
        out.write(((Comment) node).text());
        out.write(CharsForSerializing.CLOSECOMMENT.getValue());
      }
      case PROCESSING_INSTRUCTION -> {
        final ProcessingInstruction pi = (ProcessingInstruction) node;
        out.write(CharsForSerializing.OPENPI.getValue());
        out.write(pi.target());
        if (!pi.data().isEmpty()) {
          out.write(CharsForSerializing.SPACE.getValue());
          out.write(pi.data());
        }
        out.write(CharsForSerializing.CLOSEPI.getValue());
      }
      case ENTITY_REFERENCE -> {
        out.write(CharsForSerializing.AMPERSAND.getValue());
        out.write(((EntityReference) node).name());
        out.write(CharsForSerializing.SEMICOLON.getValue());
      }
      default -> throw new IllegalArgumentException("Node kind not supported: " + node.getKind());
    }
  }
}
