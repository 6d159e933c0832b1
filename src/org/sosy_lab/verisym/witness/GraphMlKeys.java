// This file is part of Verisym,
// a verification pipeline for C programs.
//
// SPDX-FileCopyrightText: 2023 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.verisym.witness;

/** Names used in the GraphML dialect of witnesses. */
final class GraphMlKeys {

  static final String NAMESPACE = "http://graphml.graphdrawing.org/xmlns";

  static final String WITNESS_TYPE = "witness-type";

  static final String ENTRY = "entry";
  static final String VIOLATION = "violation";
  static final String SINK = "sink";

  static final String START_LINE = "startline";
  static final String ASSUMPTION = "assumption";
  static final String CONTROL = "control";
  static final String SOURCE_CODE = "sourcecode";

  static final String FOR_GRAPH = "graph";
  static final String FOR_NODE = "node";
  static final String FOR_EDGE = "edge";

  private GraphMlKeys() {}
}
