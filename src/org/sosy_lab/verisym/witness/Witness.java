// This file is part of Verisym,
// a verification pipeline for C programs.
//
// SPDX-FileCopyrightText: 2023 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.verisym.witness;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.FluentIterable;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.graph.ImmutableValueGraph;
import com.google.common.graph.ValueGraph;
import java.util.Map;
import java.util.Objects;

/**
 * A witness of a verification run: a directed graph with exactly one entry node. A violation
 * witness has at least one violation node, a correctness witness has none. Instances are
 * immutable.
 */
public final class Witness {

  public static final String SOURCECODE_LANGUAGE = "sourcecodelang";
  public static final String PRODUCER = "producer";
  public static final String SPECIFICATION = "specification";
  public static final String PROGRAM_FILE = "programfile";
  public static final String PROGRAM_HASH = "programhash";
  public static final String ARCHITECTURE = "architecture";
  public static final String CREATION_TIME = "creationtime";

  /** Graph attributes in the order they are written. */
  public static final ImmutableList<String> GRAPH_ATTRIBUTES =
      ImmutableList.of(
          SOURCECODE_LANGUAGE,
          PRODUCER,
          SPECIFICATION,
          PROGRAM_FILE,
          PROGRAM_HASH,
          ARCHITECTURE,
          CREATION_TIME);

  private final WitnessType type;
  private final ImmutableValueGraph<WitnessNode, WitnessEdge> graph;
  private final ImmutableMap<String, String> attributes;

  public Witness(
      WitnessType pType,
      ValueGraph<WitnessNode, WitnessEdge> pGraph,
      Map<String, String> pAttributes) {
    checkArgument(pGraph.isDirected(), "witness graphs are directed");
    checkArgument(
        GRAPH_ATTRIBUTES.containsAll(pAttributes.keySet()),
        "unknown witness attributes in %s",
        pAttributes.keySet());

    FluentIterable<WitnessNode> nodes = FluentIterable.from(pGraph.nodes());
    checkArgument(
        nodes.filter(WitnessNode::isEntry).size() == 1, "witness needs exactly one entry node");
    int violations = nodes.filter(WitnessNode::isViolation).size();
    switch (pType) {
      case VIOLATION:
        checkArgument(violations > 0, "violation witness without violation node");
        break;
      case CORRECTNESS:
        checkArgument(violations == 0, "correctness witness with violation node");
        break;
      default:
        throw new AssertionError("unknown witness type " + pType);
    }
    checkArgument(
        nodes.transform(WitnessNode::getId).toSet().size() == pGraph.nodes().size(),
        "node ids of witness are not unique");

    type = pType;
    graph = ImmutableValueGraph.copyOf(pGraph);
    attributes = ImmutableMap.copyOf(pAttributes);
  }

  public WitnessType getType() {
    return type;
  }

  public ImmutableValueGraph<WitnessNode, WitnessEdge> getGraph() {
    return graph;
  }

  public WitnessNode getEntryNode() {
    return FluentIterable.from(graph.nodes()).firstMatch(WitnessNode::isEntry).get();
  }

  public ImmutableList<WitnessNode> getViolationNodes() {
    return FluentIterable.from(graph.nodes()).filter(WitnessNode::isViolation).toList();
  }

  public ImmutableMap<String, String> getAttributes() {
    return attributes;
  }

  @Override
  public boolean equals(Object pObj) {
    if (this == pObj) {
      return true;
    }
    if (!(pObj instanceof Witness)) {
      return false;
    }
    Witness other = (Witness) pObj;
    return type == other.type && graph.equals(other.graph) && attributes.equals(other.attributes);
  }

  @Override
  public int hashCode() {
    return Objects.hash(type, graph, attributes);
  }

  @Override
  public String toString() {
    return type.getGraphMlName() + graph;
  }
}
