package com.ifdefgraph.core.tree.dom;

import com.ifdefgraph.core.ConversionException;
import com.ifdefgraph.core.tree.TreeElement;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.StringReader;
import java.util.List;

/**
 * Parses srcML XML into the root {@link TreeElement} of one source unit.
 */
public final class SrcmlDocuments {

    private SrcmlDocuments() {}

    public static TreeElement parse(byte[] xml) throws ConversionException {
        return parse(new InputSource(new ByteArrayInputStream(xml)));
    }

    public static TreeElement parse(String xml) throws ConversionException {
        return parse(new InputSource(new StringReader(xml)));
    }

    private static TreeElement parse(InputSource source) throws ConversionException {
        Document doc;
        try {
            doc = newBuilder().parse(source);
        } catch (SAXException | IOException e) {
            throw new ConversionException("Malformed srcML output: " + e.getMessage(), e);
        }
        Element root = doc.getDocumentElement();
        if (root == null) {
            throw new ConversionException("srcML output has no root element");
        }
        DomTreeElement unit = new DomTreeElement(root);
        if (!"unit".equals(unit.tag())) {
            throw new ConversionException("Expected a srcML <unit> root but found <" + unit.tag() + ">");
        }
        // An archive wrapping exactly one file: descend into the inner unit
        List<TreeElement> children = unit.children();
        if (children.size() == 1 && "unit".equals(children.get(0).tag())) {
            return children.get(0);
        }
        return unit;
    }

    private static DocumentBuilder newBuilder() throws ConversionException {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setExpandEntityReferences(false);
            return factory.newDocumentBuilder();
        } catch (ParserConfigurationException e) {
            throw new ConversionException("XML parser unavailable: " + e.getMessage(), e);
        }
    }
}
