package com.ifdefgraph.core.tree.dom;

import com.ifdefgraph.core.tree.Span;
import com.ifdefgraph.core.tree.TreeElement;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * {@link TreeElement} backed by a W3C DOM element of a srcML document.
 */
public class DomTreeElement implements TreeElement {

    static final String SRC_NS = "http://www.srcML.org/srcML/src";
    static final String CPP_NS = "http://www.srcML.org/srcML/cpp";
    static final String POS_NS = "http://www.srcML.org/srcML/position";

    private final Element element;
    private List<TreeElement> children;

    public DomTreeElement(Element element) {
        this.element = element;
    }

    @Override
    public String tag() {
        String local = element.getLocalName();
        if (local == null) {
            // Parsed without namespace awareness: node name already carries the prefix
            return element.getNodeName();
        }
        return CPP_NS.equals(element.getNamespaceURI()) ? "cpp:" + local : local;
    }

    @Override
    public List<TreeElement> children() {
        if (children == null) {
            NodeList nodes = element.getChildNodes();
            List<TreeElement> result = new ArrayList<>();
            for (int i = 0; i < nodes.getLength(); i++) {
                Node n = nodes.item(i);
                if (n.getNodeType() == Node.ELEMENT_NODE) {
                    result.add(new DomTreeElement((Element) n));
                }
            }
            children = Collections.unmodifiableList(result);
        }
        return children;
    }

    @Override
    public String text() {
        String text = element.getTextContent();
        return text != null ? text : "";
    }

    @Override
    public Span span() {
        String start = element.getAttributeNS(POS_NS, "start");
        String end = element.getAttributeNS(POS_NS, "end");
        if (start.isEmpty()) {
            start = element.getAttribute("pos:start");
            end = element.getAttribute("pos:end");
        }
        return Span.parse(start, end);
    }
}
