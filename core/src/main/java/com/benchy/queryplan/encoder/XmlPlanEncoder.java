package com.benchy.queryplan.encoder;

import com.benchy.queryplan.exception.PlanEncodingException;
import com.benchy.queryplan.plan.PlanNode;
import java.io.StringWriter;
import java.util.Map;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

/**
 * Encodes a plan tree as XML: one element per node, named after the operator
 * type, with the node attributes as XML attributes and the children as nested
 * elements.
 *
 * <pre>
 *   &lt;Result operator_id="-1" ...&gt;&lt;TableScan operator_id="0" table_name="lineitem" .../&gt;&lt;/Result&gt;
 * </pre>
 */
public class XmlPlanEncoder implements PlanNodeEncoder<String> {

    @Override
    public String encode(PlanNode node) {
        try {
            Document document = DocumentBuilderFactory.newInstance().newDocumentBuilder().newDocument();
            document.appendChild(toElement(document, node));

            Transformer transformer = TransformerFactory.newInstance().newTransformer();
            transformer.setOutputProperty(OutputKeys.OMIT_XML_DECLARATION, "yes");
            transformer.setOutputProperty(OutputKeys.INDENT, "no");
            StringWriter writer = new StringWriter();
            transformer.transform(new DOMSource(document), new StreamResult(writer));
            return writer.toString();
        } catch (ParserConfigurationException | TransformerException e) {
            throw new PlanEncodingException("Failed to encode plan as XML", e);
        }
    }

    private Element toElement(Document document, PlanNode node) {
        Element element = document.createElement(node.operator().operatorType().name());
        for (Map.Entry<String, Object> entry : NodeAttributes.collect(node).entrySet()) {
            element.setAttribute(entry.getKey(), String.valueOf(entry.getValue()));
        }
        for (PlanNode child : node.children()) {
            element.appendChild(toElement(document, child));
        }
        return element;
    }
}
