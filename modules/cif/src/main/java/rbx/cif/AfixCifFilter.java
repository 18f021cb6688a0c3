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
package rbx.cif;

import static java.lang.String.format;
import static rbx.cif.RecordTable.NOT_PRESENT;
import static rbx.cif.RecordTable.isPresent;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.apache.commons.configuration2.CompositeConfiguration;
import org.apache.commons.io.FileUtils;
import org.apache.commons.io.FilenameUtils;

import rbx.afix.AfixCode;
import rbx.afix.AfixException;
import rbx.afix.ConstraintCodec;
import rbx.afix.DirectiveCodeTable;
import rbx.afix.MissingRefineInstructionsException;
import rbx.afix.SfacTable;
import rbx.afix.UnencodableGraphException;
import rbx.afix.graph.AtomRecord;
import rbx.afix.graph.ConstraintDef;
import rbx.afix.graph.ConstraintGraph;
import rbx.afix.graph.Displacement;
import rbx.afix.graph.Displacement.Anisotropic;
import rbx.afix.graph.Displacement.Independent;
import rbx.afix.graph.Displacement.MultiplierOf;
import rbx.afix.parsers.InsFile;
import rbx.utilities.RBXProperties;
import rbx.utilities.StringUtils;

/**
 * The AfixCifFilter class moves SHELXL AFIX constraints between the instruction text embedded in
 * a CIF block and relational CIF columns.
 *
 * <p>{@link #afixToCif(RecordBlock)} decodes the embedded instructions and writes the constraint
 * of every atom into the <code>_atom_site</code> loop, together with the
 * <code>_qcrbox_constraint_posn</code> table that describes each constraint.
 * {@link #cifToInstructions(RecordBlock)} goes the other way.
 *
 * @author Aaron J. Nessler
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class AfixCifFilter {

  private static final Logger logger = Logger.getLogger(AfixCifFilter.class.getName());

  /** Instruction text written by refinement programs following the IUCr convention. */
  public static final String REFINE_INSTRUCTIONS = "_iucr.refine_instructions_details";
  /** Instruction text written by SHELXL. */
  public static final String RES_FILE = "_shelx.res_file";
  /** Overall scale factor taken from the first FVAR parameter. */
  public static final String SCALE_FACTOR = "_qcrbox.shelx.scale_factor";

  public static final String ATOM_SITE = "atom_site";
  public static final String ATOM_SITE_ANISO = "atom_site_aniso";
  public static final String CONSTRAINT_POSN = "qcrbox_constraint_posn";

  static final String ATTACHED_ATOM = "calc_attached_atom";
  static final String CONSTRAINT_ID = "qcrbox_constraint_posn_id";
  static final String CONSTRAINT_INDEX = "qcrbox_constraint_posn_index";
  static final String UISO_MULTIPLIER = "qcrbox_calc_uiso_multiplier";

  private static final String[] U_IJ = {"u_11", "u_22", "u_33", "u_23", "u_13", "u_12"};
  private static final int DESCRIPTION_WIDTH = 70;

  private final ConstraintCodec codec;
  private final int multiplierDecimals;
  private final double occupancy;
  private final boolean keepInstructions;

  public AfixCifFilter() {
    this(RBXProperties.loadProperties());
  }

  /**
   * Create a filter with settings read from the configuration.
   *
   * @param properties the configuration.
   */
  public AfixCifFilter(CompositeConfiguration properties) {
    codec = new ConstraintCodec(properties);
    multiplierDecimals = properties.getInt(RBXProperties.UISO_MULTIPLIER_DECIMALS,
        RBXProperties.DEFAULT_UISO_MULTIPLIER_DECIMALS);
    occupancy = properties.getDouble(RBXProperties.INS_OCCUPANCY, RBXProperties.DEFAULT_INS_OCCUPANCY);
    keepInstructions = properties.getBoolean(RBXProperties.KEEP_INSTRUCTIONS, false);
  }

  /**
   * Embedded instruction text of a block.
   *
   * @param block the block.
   * @return the text of {@link #REFINE_INSTRUCTIONS}, else of {@link #RES_FILE}, else null.
   */
  public static String instructionText(RecordBlock block) {
    String text = block.getItem(REFINE_INSTRUCTIONS);
    if (text == null) {
      text = block.getItem(RES_FILE);
    }
    return isPresent(text) ? text : null;
  }

  /**
   * Read a CIF file. When the first block carries no instruction text, a sibling
   * <code>.res</code> or <code>.ins</code> file with the same base name supplies it as
   * {@link #RES_FILE}.
   *
   * @param path the CIF file.
   * @return the data blocks.
   * @throws IOException if a file cannot be read.
   */
  public List<RecordBlock> readCif(Path path) throws IOException {
    List<RecordBlock> blocks = new CifBlockReader().read(path);
    if (blocks.isEmpty()) {
      throw new IOException(format(" %s contains no data block.", path));
    }
    RecordBlock first = blocks.get(0);
    if (instructionText(first) != null) {
      return blocks;
    }
    String base = FilenameUtils.removeExtension(path.toAbsolutePath().toString());
    for (String extension : new String[] {".res", ".ins"}) {
      File sibling = new File(base + extension);
      if (sibling.isFile()) {
        logger.info(format(" Reading SHELXL instructions from %s", sibling.getName()));
        first.setItem(RES_FILE, FileUtils.readFileToString(sibling, StandardCharsets.UTF_8));
        return blocks;
      }
    }
    logger.warning(format(" No instructions in %s and no %s.res or %s.ins file was found.",
        path.getFileName(), FilenameUtils.getName(base), FilenameUtils.getName(base)));
    return blocks;
  }

  public List<RecordBlock> readCif(File file) throws IOException {
    return readCif(file.toPath());
  }

  /**
   * Convert the embedded AFIX instructions of a block into constraint columns.
   *
   * @param block the block; it is updated in place.
   * @return the same block.
   * @throws MissingRefineInstructionsException if the block has no instruction text.
   * @throws RecordCountMismatchException       if the atom tables and the instructions disagree.
   * @throws AfixException                      if the instructions cannot be decoded.
   */
  public RecordBlock afixToCif(RecordBlock block) throws AfixException {
    String text = instructionText(block);
    if (text == null) {
      throw new MissingRefineInstructionsException(format(
          " No refine instructions (%s, %s) found in block %s.", REFINE_INSTRUCTIONS, RES_FILE, block.getName()));
    }
    InsFile insFile = codec.read(text);
    ConstraintGraph graph = codec.decode(insFile);

    RecordTable atomSite = block.getTable(ATOM_SITE);
    if (atomSite == null) {
      atomSite = new RecordTable(ATOM_SITE);
      block.putTable(atomSite);
    }
    List<String> labels = labels(graph, false);
    checkLabels(atomSite, labels);

    RecordTable aniso = block.getTable(ATOM_SITE_ANISO);
    List<String> anisoLabels = labels(graph, true);
    if (aniso == null && !anisoLabels.isEmpty()) {
      aniso = new RecordTable(ATOM_SITE_ANISO);
      aniso.setColumn("label", anisoLabels);
      block.putTable(aniso);
    }
    if (aniso != null) {
      checkLabels(aniso, anisoLabels);
    }

    updateAtomSite(atomSite, graph);
    if (aniso != null) {
      updateAniso(aniso, graph);
    }
    block.putTable(constraintTable(graph));

    if (insFile.getScaleFactor() != null) {
      block.setItem(SCALE_FACTOR, insFile.getScaleFactor());
    }

    if (insFile.hasUnrepresentableInstructions()) {
      logger.info(format(" Instruction text kept for %s.", insFile.getUnrepresentableInstructions()));
    } else if (keepInstructions) {
      logger.info(format(" Instruction text kept (%s).", RBXProperties.KEEP_INSTRUCTIONS));
    } else if (!block.removeItem(REFINE_INSTRUCTIONS)) {
      block.removeItem(RES_FILE);
    }

    logger.info(format(" Converted %d atoms and %d AFIX constraints of block %s.",
        graph.size(), graph.getCatalogue().size(), block.getName()));
    return block;
  }

  /**
   * SHELXL instructions for a block. Embedded instruction text is returned unchanged; otherwise
   * the atom table is rebuilt from the atom site and constraint tables.
   *
   * @param block the block.
   * @return the instruction text.
   * @throws MissingRefineInstructionsException if there is neither instruction text nor an
   *                                            <code>_atom_site</code> table.
   * @throws AfixException                      if the constraint columns cannot be encoded.
   */
  public String cifToInstructions(RecordBlock block) throws AfixException {
    String text = instructionText(block);
    if (text != null) {
      return text;
    }
    RecordTable atomSite = block.getTable(ATOM_SITE);
    if (atomSite == null || !atomSite.hasColumn("label")) {
      throw new MissingRefineInstructionsException(format(
          " Block %s has neither refine instructions nor an atom_site table.", block.getName()));
    }
    SfacTable sfacTable = sfacTable(atomSite);
    ConstraintGraph graph = buildGraph(block, atomSite, sfacTable);

    List<String> lines = new ArrayList<>();
    lines.add("TITL " + block.getName());
    lines.add(sfacTable.toSfacLine());
    String scale = block.getItem(SCALE_FACTOR);
    lines.add("FVAR " + (isPresent(scale) ? scale : "1.0"));
    lines.addAll(codec.encode(graph));
    lines.add("HKLF 4");
    lines.add("END");

    logger.info(format(" Rebuilt instructions for %d atoms of block %s.", graph.size(), block.getName()));
    return String.join("\n", lines) + "\n";
  }

  private static List<String> labels(ConstraintGraph graph, boolean anisotropicOnly) {
    List<String> labels = new ArrayList<>();
    for (AtomRecord atom : graph.getAtoms()) {
      if (!anisotropicOnly || atom.displacement() instanceof Anisotropic) {
        labels.add(atom.label());
      }
    }
    return labels;
  }

  private static void checkLabels(RecordTable table, List<String> expected)
      throws RecordCountMismatchException {
    List<String> present = table.hasColumn("label") ? table.getColumn("label") : List.of();
    Set<String> presentSet = new LinkedHashSet<>(present);
    Set<String> expectedSet = new LinkedHashSet<>(expected);
    List<String> missing = new ArrayList<>();
    for (String label : expected) {
      if (!presentSet.contains(label)) {
        missing.add(label);
      }
    }
    List<String> unexpected = new ArrayList<>();
    for (String label : present) {
      if (!expectedSet.contains(label)) {
        unexpected.add(label);
      }
    }
    if (!missing.isEmpty() || !unexpected.isEmpty() || present.size() != presentSet.size()) {
      throw new RecordCountMismatchException(table.getName(), missing, unexpected);
    }
  }

  private void updateAtomSite(RecordTable atomSite, ConstraintGraph graph) {
    int rows = atomSite.getRowCount();
    List<String> x = column(atomSite, "fract_x", rows);
    List<String> y = column(atomSite, "fract_y", rows);
    List<String> z = column(atomSite, "fract_z", rows);
    List<String> uIso = column(atomSite, "u_iso_or_equiv", rows);
    List<String> attached = new ArrayList<>(rows);
    List<String> ids = new ArrayList<>(rows);
    List<String> indices = new ArrayList<>(rows);
    List<String> multipliers = new ArrayList<>(rows);

    for (int row = 0; row < rows; row++) {
      AtomRecord atom = graph.getAtom(atomSite.getValue("label", row));
      x.set(row, StringUtils.exactDecimal(atom.x()));
      y.set(row, StringUtils.exactDecimal(atom.y()));
      z.set(row, StringUtils.exactDecimal(atom.z()));
      if (atom.displacement() instanceof Independent independent) {
        uIso.set(row, StringUtils.exactDecimal(independent.uIso()));
      }
      attached.add(atom.isAttached() ? atom.attachedTo() : NOT_PRESENT);
      ids.add(atom.isConstrained() ? atom.constraintId() : NOT_PRESENT);
      indices.add(atom.isConstrained() ? Integer.toString(atom.positionIndex()) : NOT_PRESENT);
      if (atom.displacement() instanceof MultiplierOf multiplier) {
        multipliers.add(StringUtils.decOrExact(multiplier.factor(), multiplierDecimals));
      } else {
        multipliers.add(NOT_PRESENT);
      }
    }

    atomSite.setColumn("fract_x", x);
    atomSite.setColumn("fract_y", y);
    atomSite.setColumn("fract_z", z);
    atomSite.setColumn("u_iso_or_equiv", uIso);
    atomSite.setColumn(ATTACHED_ATOM, attached);
    atomSite.setColumn(CONSTRAINT_ID, ids);
    atomSite.setColumn(CONSTRAINT_INDEX, indices);
    atomSite.setColumn(UISO_MULTIPLIER, multipliers);
  }

  private static void updateAniso(RecordTable aniso, ConstraintGraph graph) {
    int rows = aniso.getRowCount();
    List<List<String>> columns = new ArrayList<>();
    for (String uij : U_IJ) {
      columns.add(column(aniso, uij, rows));
    }
    for (int row = 0; row < rows; row++) {
      Anisotropic u = (Anisotropic) graph.getAtom(aniso.getValue("label", row)).displacement();
      double[] values = u.values();
      for (int i = 0; i < U_IJ.length; i++) {
        columns.get(i).set(row, StringUtils.exactDecimal(values[i]));
      }
    }
    for (int i = 0; i < U_IJ.length; i++) {
      aniso.setColumn(U_IJ[i], columns.get(i));
    }
  }

  /** Copy of a column, or a column of "?" when the table does not have it. */
  private static List<String> column(RecordTable table, String name, int rows) {
    if (table.hasColumn(name)) {
      return new ArrayList<>(table.getColumn(name));
    }
    List<String> values = new ArrayList<>(rows);
    for (int i = 0; i < rows; i++) {
      values.add(RecordTable.UNKNOWN);
    }
    return values;
  }

  private static RecordTable constraintTable(ConstraintGraph graph) {
    List<String> ids = new ArrayList<>();
    List<String> refined = new ArrayList<>();
    List<String> instructions = new ArrayList<>();
    for (ConstraintDef def : graph.getCatalogue().values()) {
      ids.add(def.id());
      refined.add(def.dofPolicy());
      instructions.add(String.join("\n", StringUtils.wrap(def.shapeDescription(), DESCRIPTION_WIDTH)));
    }
    RecordTable table = new RecordTable(CONSTRAINT_POSN);
    table.setColumn("id", ids);
    table.setColumn("refined_pars", refined);
    table.setColumn("instruction", instructions);
    return table;
  }

  /**
   * Scattering types: C and H first, then the other elements in order of appearance.
   */
  private static SfacTable sfacTable(RecordTable atomSite) {
    Set<String> elements = new LinkedHashSet<>();
    for (int row = 0; row < atomSite.getRowCount(); row++) {
      elements.add(StringUtils.capitalizeElement(element(atomSite, row)));
    }
    SfacTable sfacTable = new SfacTable();
    for (String first : new String[] {"C", "H"}) {
      if (elements.remove(first)) {
        sfacTable.add(first);
      }
    }
    for (String element : elements) {
      sfacTable.add(element);
    }
    return sfacTable;
  }

  private static String element(RecordTable atomSite, int row) {
    String symbol = atomSite.getValue("type_symbol", row);
    if (isPresent(symbol)) {
      return symbol;
    }
    String label = atomSite.getValue("label", row);
    int end = 0;
    while (end < label.length() && Character.isLetter(label.charAt(end))) {
      end++;
    }
    if (end >= 2 && Character.isLowerCase(label.charAt(1))) {
      return label.substring(0, 2);
    }
    return label.substring(0, Math.min(1, label.length()));
  }

  private ConstraintGraph buildGraph(RecordBlock block, RecordTable atomSite, SfacTable sfacTable)
      throws AfixException {
    Map<String, Integer> anisoRows = new HashMap<>();
    RecordTable aniso = block.getTable(ATOM_SITE_ANISO);
    if (aniso != null && aniso.hasColumn("label")) {
      for (int row = 0; row < aniso.getRowCount(); row++) {
        anisoRows.put(aniso.getValue("label", row), row);
      }
    }

    Set<String> referenced = new LinkedHashSet<>();
    List<AtomRecord> atoms = new ArrayList<>();
    for (int row = 0; row < atomSite.getRowCount(); row++) {
      String label = atomSite.getValue("label", row);
      String element = StringUtils.capitalizeElement(element(atomSite, row));
      double x = number(atomSite, "fract_x", row, label);
      double y = number(atomSite, "fract_y", row, label);
      double z = number(atomSite, "fract_z", row, label);

      Displacement displacement;
      String multiplier = atomSite.getValue(UISO_MULTIPLIER, row);
      if (isPresent(multiplier)) {
        double factor = number(atomSite, UISO_MULTIPLIER, row, label);
        if (!(factor > 0.0) || Double.isInfinite(factor)) {
          throw new UnencodableGraphException(label,
              format("%s must be a positive factor (%s).", atomSite.dataName(UISO_MULTIPLIER), multiplier));
        }
        displacement = new MultiplierOf(factor);
      } else if (anisoRows.containsKey(label)) {
        double[] u = new double[U_IJ.length];
        for (int i = 0; i < U_IJ.length; i++) {
          u[i] = number(aniso, U_IJ[i], anisoRows.get(label), label);
        }
        displacement = new Anisotropic(u[0], u[1], u[2], u[3], u[4], u[5]);
      } else {
        displacement = new Independent(number(atomSite, "u_iso_or_equiv", row, label));
      }

      String attachedTo = present(atomSite.getValue(ATTACHED_ATOM, row));
      String constraintId = present(atomSite.getValue(CONSTRAINT_ID, row));
      int positionIndex = 0;
      if (constraintId != null) {
        positionIndex = integer(atomSite, CONSTRAINT_INDEX, row, label);
        referenced.add(constraintId);
      }
      atoms.add(new AtomRecord(label, element, sfacTable.indexOf(element), attachedTo, constraintId,
          positionIndex, x, y, z, occupancy, displacement));
    }

    // Table rows no atom refers to are dropped; the rest keep the table order.
    Map<String, ConstraintDef> catalogue = new LinkedHashMap<>();
    RecordTable constraints = block.getTable(CONSTRAINT_POSN);
    if (constraints != null && constraints.hasColumn("id")) {
      for (int row = 0; row < constraints.getRowCount(); row++) {
        String id = constraints.getValue("id", row);
        if (referenced.contains(id) && !catalogue.containsKey(id)) {
          catalogue.put(id, constraintDef(id, constraints, row));
        }
      }
    }
    for (String id : referenced) {
      if (!catalogue.containsKey(id)) {
        catalogue.put(id, constraintDef(id, null, -1));
      }
    }

    if (logger.isLoggable(Level.FINE)) {
      logger.fine(format(" Rebuilt %d atoms with constraints %s.", atoms.size(), catalogue.keySet()));
    }
    try {
      return new ConstraintGraph(atoms, catalogue.values());
    } catch (IllegalArgumentException e) {
      throw new UnencodableGraphException(block.getName(), e.getMessage().strip());
    }
  }

  /**
   * Definition of a constraint id. SHELXL ids are looked up in the directive code table; other
   * ids keep the description of the constraint table and are rejected by the encoder.
   */
  private static ConstraintDef constraintDef(String id, RecordTable constraints, int row)
      throws AfixException {
    if (AfixCode.isConstraintId(id)) {
      return DirectiveCodeTable.constraintDef(AfixCode.fromConstraintId(id));
    }
    if (constraints == null) {
      throw new UnencodableGraphException(id, "The constraint is not described in the "
          + CONSTRAINT_POSN + " table.");
    }
    return new ConstraintDef(id, 0, 0, constraints.getValue("instruction", row),
        constraints.getValue("refined_pars", row));
  }

  private static String present(String value) {
    return isPresent(value) ? value : null;
  }

  private static int integer(RecordTable table, String column, int row, String label)
      throws UnencodableGraphException {
    String value = table.getValue(column, row);
    if (!isPresent(value)) {
      throw new UnencodableGraphException(label, format("No value for %s.", table.dataName(column)));
    }
    try {
      return Integer.parseInt(value.strip());
    } catch (NumberFormatException e) {
      throw new UnencodableGraphException(label,
          format("%s is not an integer (%s).", table.dataName(column), value));
    }
  }

  /** Numeric value of a field, ignoring a trailing standard uncertainty such as "0.1234(5)". */
  private static double number(RecordTable table, String column, int row, String label)
      throws UnencodableGraphException {
    String value = table.getValue(column, row);
    if (!isPresent(value)) {
      throw new UnencodableGraphException(label, format("No value for %s.", table.dataName(column)));
    }
    int su = value.indexOf('(');
    String number = su > 0 ? value.substring(0, su) : value;
    try {
      return Double.parseDouble(number);
    } catch (NumberFormatException e) {
      throw new UnencodableGraphException(label,
          format("%s is not a number (%s).", table.dataName(column), value));
    }
  }
}
