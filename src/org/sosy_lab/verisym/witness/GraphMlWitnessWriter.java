// This file is part of Verisym,
// a verification pipeline for C programs.
//
// SPDX-FileCopyrightText: 2023 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.verisym.witness;

import static org.sosy_lab.verisym.witness.GraphMlKeys.NAMESPACE;

import com.google.common.graph.EndpointPair;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.sosy_lab.verisym.exceptions.WitnessEncodingException;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

/** Writes witnesses as GraphML documents. */
public final class GraphMlWitnessWriter {

  public void write(Witness pWitness, Path pFile) throws WitnessEncodingException {
    try {
      Path parent = pFile.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      try (Writer out = Files.newBufferedWriter(pFile, StandardCharsets.UTF_8)) {
        write(pWitness, out);
      }
    } catch (IOException e) {
      throw new WitnessEncodingException(
          "Cannot write witness to " + pFile + ": " + e.getMessage(), e);
    }
  }

  public void write(Witness pWitness, Writer pOut) throws WitnessEncodingException {
    Document doc = toDocument(pWitness);
    try {
      Transformer transformer = TransformerFactory.newInstance().newTransformer();
      transformer.setOutputProperty(OutputKeys.ENCODING, StandardCharsets.UTF_8.name());
      transformer.setOutputProperty(OutputKeys.INDENT, "yes");
      transformer.setOutputProperty("{http://xml.apache.org/xslt}indent-amount", "2");
      transformer.transform(new DOMSource(doc), new StreamResult(pOut));
    } catch (TransformerException e) {
      throw new WitnessEncodingException("Cannot serialize witness: " + e.getMessage(), e);
    }
  }

  private Document toDocument(Witness pWitness) throws WitnessEncodingException {
    Document doc;
    try {
      doc = DocumentBuilderFactory.newInstance().newDocumentBuilder().newDocument();
    } catch (ParserConfigurationException e) {
      throw new WitnessEncodingException("Cannot create XML document", e);
    }

    Element root = doc.createElementNS(NAMESPACE, "graphml");
    doc.appendChild(root);

    root.appendChild(key(doc, GraphMlKeys.WITNESS_TYPE, GraphMlKeys.FOR_GRAPH, "string", null));
    for (String attribute : pWitness.getAttributes().keySet()) {
      root.appendChild(key(doc, attribute, GraphMlKeys.FOR_GRAPH, "string", null));
    }
    for (String flag :
        new String[] {GraphMlKeys.ENTRY, GraphMlKeys.VIOLATION, GraphMlKeys.SINK}) {
      root.appendChild(key(doc, flag, GraphMlKeys.FOR_NODE, "boolean", "false"));
    }
    root.appendChild(key(doc, GraphMlKeys.START_LINE, GraphMlKeys.FOR_EDGE, "int", null));
    root.appendChild(key(doc, GraphMlKeys.ASSUMPTION, GraphMlKeys.FOR_EDGE, "string", null));
    root.appendChild(key(doc, GraphMlKeys.CONTROL, GraphMlKeys.FOR_EDGE, "string", null));
    root.appendChild(key(doc, GraphMlKeys.SOURCE_CODE, GraphMlKeys.FOR_EDGE, "string", null));

    Element graph = doc.createElementNS(NAMESPACE, "graph");
    graph.setAttribute("edgedefault", "directed");
    root.appendChild(graph);

    graph.appendChild(data(doc, GraphMlKeys.WITNESS_TYPE, pWitness.getType().getGraphMlName()));
    pWitness.getAttributes().forEach((name, value) -> graph.appendChild(data(doc, name, value)));

    for (WitnessNode node : pWitness.getGraph().nodes()) {
      Element element = doc.createElementNS(NAMESPACE, "node");
      element.setAttribute("id", node.getId());
      if (node.isEntry()) {
        element.appendChild(data(doc, GraphMlKeys.ENTRY, "true"));
      }
      if (node.isViolation()) {
        element.appendChild(data(doc, GraphMlKeys.VIOLATION, "true"));
      }
      if (node.isSink()) {
        element.appendChild(data(doc, GraphMlKeys.SINK, "true"));
      }
      graph.appendChild(element);
    }

    for (EndpointPair<WitnessNode> endpoints : pWitness.getGraph().edges()) {
      WitnessEdge edge = pWitness.getGraph().edgeValue(endpoints).orElseThrow();
      Element element = doc.createElementNS(NAMESPACE, "edge");
      element.setAttribute("source", endpoints.source().getId());
      element.setAttribute("target", endpoints.target().getId());
      element.appendChild(
          data(doc, GraphMlKeys.START_LINE, Integer.toString(edge.getStartLine())));
      edge.getAssumption()
          .ifPresent(a -> element.appendChild(data(doc, GraphMlKeys.ASSUMPTION, a)));
      edge.getControl()
          .ifPresent(
              c -> element.appendChild(data(doc, GraphMlKeys.CONTROL, c.getWitnessValue())));
      edge.getSourceCode()
          .ifPresent(s -> element.appendChild(data(doc, GraphMlKeys.SOURCE_CODE, s)));
      graph.appendChild(element);
    }
    return doc;
  }

  private static Element key(
      Document pDoc, String pName, String pFor, String pType, @Nullable String pDefault) {
    Element key = pDoc.createElementNS(NAMESPACE, "key");
    key.setAttribute("id", pName);
    key.setAttribute("for", pFor);
    key.setAttribute("attr.name", pName);
    key.setAttribute("attr.type", pType);
    if (pDefault != null) {
      Element value = pDoc.createElementNS(NAMESPACE, "default");
      value.setTextContent(pDefault);
      key.appendChild(value);
    }
    return key;
  }

  private static Element data(Document pDoc, String pKey, String pValue) {
    Element data = pDoc.createElementNS(NAMESPACE, "data");
    data.setAttribute("key", pKey);
    data.setTextContent(pValue);
    return data;
  }
}
