// ******************************************************************************
//
// Title:       RBX.
// Description: RBX - Rigid-Body constraint eXchange for SHELXL and CIF.
// Copyright:   Copyright (c) RBX developers 2023.
//
// This file is part of RBX.
//
// RBX is free software; you can redistribute it and/or modify it
// under the terms of the GNU General Public License version 3 as published by
// the Free Software Foundation.
//
// RBX is distributed in the hope that it will be useful, but WITHOUT
// ANY WARRANTY; without even the implied warranty of MERCHANTABILITY or FITNESS
// FOR A PARTICULAR PURPOSE. See the GNU General Public License for more
// details.
//
// You should have received a copy of the GNU General Public License along with
// RBX; if not, write to the Free Software Foundation, Inc., 59 Temple
// Place, Suite 330, Boston, MA 02111-1307 USA
//
// Linking this library statically or dynamically with other modules is making a
// combined work based on this library. Thus, the terms and conditions of the
// GNU General Public License cover the whole combination.
//
// As a special exception, the copyright holders of this library give you
// permission to link this library with independent modules to produce an
// executable, regardless of the license terms of these independent modules, and
// to copy and distribute the resulting executable under terms of your choice,
// provided that you also meet, for each linked independent module, the terms
// and conditions of the license of that module. An independent module is a
// module which is not derived from or based on this library. If you modify this
// library, you may extend this exception to your version of the library, but
// you are not obligated to do so. If you do not wish to do so, delete this
// exception statement from your version.
//
// ******************************************************************************
package rbx.afix;

import java.util.List;

import org.apache.commons.configuration2.CompositeConfiguration;

import rbx.afix.graph.ConstraintGraph;
import rbx.afix.parsers.InsFile;
import rbx.afix.parsers.InsLine;
import rbx.afix.parsers.InsReader;

/**
 * Converts between SHELXL instruction text and constraint graphs.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class ConstraintCodec {

  private final InsReader reader = new InsReader();
  private final StreamDecoder decoder = new StreamDecoder();
  private final GraphEncoder encoder;

  public ConstraintCodec() {
    this.encoder = new GraphEncoder();
  }

  public ConstraintCodec(CompositeConfiguration properties) {
    this.encoder = new GraphEncoder(properties);
  }

  /**
   * Read instruction text without decoding its constraints.
   *
   * @param insText the content of a .ins or .res file.
   * @return the InsFile.
   * @throws MissingRefineInstructionsException if the text is null or blank.
   * @throws MalformedDirectiveException        if an atom-table line cannot be read.
   */
  public InsFile read(String insText) throws MissingRefineInstructionsException, MalformedDirectiveException {
    if (insText == null || insText.isBlank()) {
      throw new MissingRefineInstructionsException(" No SHELXL instructions were given.");
    }
    return reader.read(insText);
  }

  /**
   * Decode the AFIX constraints of instruction text.
   *
   * @param insText the content of a .ins or .res file.
   * @return the ConstraintGraph.
   * @throws AfixException if the text is missing or its constraints cannot be decoded.
   */
  public ConstraintGraph decode(String insText) throws AfixException {
    return decode(read(insText));
  }

  public ConstraintGraph decode(InsFile insFile) throws AfixException {
    return decoder.decode(insFile.getAtomTable(), insFile.getSfacTable());
  }

  public ConstraintGraph decode(List<? extends InsLine> lines, AtomTypeLookup atomTypeLookup)
      throws AfixException {
    return decoder.decode(lines, atomTypeLookup);
  }

  /**
   * Encode a constraint graph as atom-table lines.
   *
   * @param graph the ConstraintGraph.
   * @return the lines.
   * @throws AfixException if the graph cannot be written as AFIX instructions.
   */
  public List<String> encode(ConstraintGraph graph) throws AfixException {
    return encoder.encode(graph);
  }

  /**
   * Encode a constraint graph as newline separated atom-table text.
   */
  public String encodeText(ConstraintGraph graph) throws AfixException {
    return String.join("\n", encode(graph));
  }

  public GraphEncoder getEncoder() {
    return encoder;
  }
}
