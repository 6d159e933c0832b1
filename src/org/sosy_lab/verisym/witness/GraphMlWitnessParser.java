// This file is part of Verisym,
// a verification pipeline for C programs.
//
// SPDX-FileCopyrightText: 2023 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.verisym.witness;

import static org.sosy_lab.verisym.witness.GraphMlKeys.NAMESPACE;

import com.google.common.collect.ImmutableList;
import com.google.common.graph.MutableValueGraph;
import com.google.common.graph.ValueGraphBuilder;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.sosy_lab.verisym.exceptions.WitnessEncodingException;
import org.sosy_lab.verisym.trace.BranchDirection;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.xml.sax.SAXException;

/**
 * Reads witnesses in the GraphML dialect of {@link GraphMlWitnessWriter}. Documents with data keys
 * that are not declared, or declared for a different element, are rejected.
 */
public final class GraphMlWitnessParser {

  public Witness parse(Path pFile) throws WitnessEncodingException, IOException {
    try (InputStream in = Files.newInputStream(pFile)) {
      return parse(in);
    }
  }

  public Witness parse(InputStream pIn) throws WitnessEncodingException, IOException {
    Document doc;
    try {
      DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
      factory.setNamespaceAware(true);
      factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
      factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
      DocumentBuilder builder = factory.newDocumentBuilder();
      doc = builder.parse(pIn);
    } catch (ParserConfigurationException e) {
      throw new AssertionError("XML parser does not support secure processing", e);
    } catch (SAXException e) {
      throw new WitnessEncodingException("Witness is not well-formed XML: " + e.getMessage(), e);
    }

    Element root = doc.getDocumentElement();
    expect(root, "graphml");

    // key id -> element kind
    Map<String, String> keys = new HashMap<>();
    for (Element key : children(root, "key")) {
      keys.put(key.getAttribute("id"), key.getAttribute("for"));
    }
    ImmutableList<Element> graphs = children(root, "graph");
    if (graphs.size() != 1) {
      throw new WitnessEncodingException("Witness must contain exactly one graph");
    }
    Element graphElement = graphs.get(0);

    @Nullable WitnessType type = null;
    Map<String, String> attributes = new LinkedHashMap<>();
    for (Map.Entry<String, String> data : data(graphElement, keys, GraphMlKeys.FOR_GRAPH)) {
      if (data.getKey().equals(GraphMlKeys.WITNESS_TYPE)) {
        type =
            WitnessType.fromGraphMlName(data.getValue())
                .orElseThrow(
                    () -> new WitnessEncodingException("Unknown witness type " + data.getValue()));
      } else if (Witness.GRAPH_ATTRIBUTES.contains(data.getKey())) {
        attributes.put(data.getKey(), data.getValue());
      } else {
        throw new WitnessEncodingException("Unknown graph attribute " + data.getKey());
      }
    }
    if (type == null) {
      throw new WitnessEncodingException("Witness does not declare its type");
    }

    MutableValueGraph<WitnessNode, WitnessEdge> graph = ValueGraphBuilder.directed().build();
    Map<String, WitnessNode> nodes = new HashMap<>();
    for (Element element : children(graphElement, "node")) {
      WitnessNode node = toNode(element, keys);
      if (nodes.put(node.getId(), node) != null) {
        throw new WitnessEncodingException("Duplicate node " + node.getId());
      }
      graph.addNode(node);
    }
    for (Element element : children(graphElement, "edge")) {
      WitnessNode source = nodes.get(element.getAttribute("source"));
      WitnessNode target = nodes.get(element.getAttribute("target"));
      if (source == null || target == null) {
        throw new WitnessEncodingException(
            "Edge between unknown nodes "
                + element.getAttribute("source")
                + " and "
                + element.getAttribute("target"));
      }
      graph.putEdgeValue(source, target, toEdge(element, keys));
    }

    try {
      return new Witness(type, graph, attributes);
    } catch (IllegalArgumentException e) {
      throw new WitnessEncodingException("Invalid witness: " + e.getMessage(), e);
    }
  }

  private static WitnessNode toNode(Element pElement, Map<String, String> pKeys)
      throws WitnessEncodingException {
    String id = pElement.getAttribute("id");
    if (id.isEmpty()) {
      throw new WitnessEncodingException("Node without id");
    }
    boolean entry = false;
    boolean violation = false;
    boolean sink = false;
    for (Map.Entry<String, String> data : data(pElement, pKeys, GraphMlKeys.FOR_NODE)) {
      boolean value = parseBoolean(data.getKey(), data.getValue());
      switch (data.getKey()) {
        case GraphMlKeys.ENTRY:
          entry = value;
          break;
        case GraphMlKeys.VIOLATION:
          violation = value;
          break;
        case GraphMlKeys.SINK:
          sink = value;
          break;
        default:
          throw new WitnessEncodingException("Unknown node attribute " + data.getKey());
      }
    }
    return new WitnessNode(id, entry, violation, sink);
  }

  private static WitnessEdge toEdge(Element pElement, Map<String, String> pKeys)
      throws WitnessEncodingException {
    @Nullable Integer startLine = null;
    @Nullable String assumption = null;
    @Nullable BranchDirection control = null;
    @Nullable String sourceCode = null;
    for (Map.Entry<String, String> data : data(pElement, pKeys, GraphMlKeys.FOR_EDGE)) {
      switch (data.getKey()) {
        case GraphMlKeys.START_LINE:
          try {
            startLine = Integer.parseInt(data.getValue().trim());
          } catch (NumberFormatException e) {
            throw new WitnessEncodingException("Invalid start line " + data.getValue(), e);
          }
          break;
        case GraphMlKeys.ASSUMPTION:
          assumption = data.getValue();
          break;
        case GraphMlKeys.CONTROL:
          control =
              BranchDirection.fromWitnessValue(data.getValue())
                  .orElseThrow(
                      () -> new WitnessEncodingException("Invalid control " + data.getValue()));
          break;
        case GraphMlKeys.SOURCE_CODE:
          sourceCode = data.getValue();
          break;
        default:
          throw new WitnessEncodingException("Unknown edge attribute " + data.getKey());
      }
    }
    if (startLine == null || startLine <= 0) {
      throw new WitnessEncodingException("Edge without valid start line");
    }
    return new WitnessEdge(startLine, assumption, control, sourceCode);
  }

  private static boolean parseBoolean(String pKey, String pValue)
      throws WitnessEncodingException {
    switch (pValue.trim()) {
      case "true":
        return true;
      case "false":
        return false;
      default:
        throw new WitnessEncodingException("Invalid value " + pValue + " for " + pKey);
    }
  }

  /** The data children of an element, checked against the declared keys. */
  private static ImmutableList<Map.Entry<String, String>> data(
      Element pElement, Map<String, String> pKeys, String pFor) throws WitnessEncodingException {
    ImmutableList.Builder<Map.Entry<String, String>> result = ImmutableList.builder();
    for (Element data : children(pElement, "data")) {
      String key = data.getAttribute("key");
      if (!pFor.equals(pKeys.get(key))) {
        throw new WitnessEncodingException("Data key " + key + " is not declared for " + pFor);
      }
      result.add(Map.entry(key, data.getTextContent()));
    }
    return result.build();
  }

  private static ImmutableList<Element> children(Element pParent, String pName) {
    ImmutableList.Builder<Element> result = ImmutableList.builder();
    for (Node child = pParent.getFirstChild(); child != null; child = child.getNextSibling()) {
      if (child instanceof Element
          && NAMESPACE.equals(child.getNamespaceURI())
          && pName.equals(child.getLocalName())) {
        result.add((Element) child);
      }
    }
    return result.build();
  }

  private static void expect(Element pElement, String pName) throws WitnessEncodingException {
    if (!NAMESPACE.equals(pElement.getNamespaceURI()) || !pName.equals(pElement.getLocalName())) {
      throw new WitnessEncodingException(
          "Expected GraphML element " + pName + " but found " + pElement.getTagName());
    }
  }
}
