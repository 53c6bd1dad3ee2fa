package com.benchy.queryplan.encoder;

import com.benchy.queryplan.exception.PlanEncodingException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import org.w3c.dom.Attr;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

/**
 * Reads interchange documents written by {@link QueryPlanEncoder} back into a
 * generic tree of labels, attributes and children.
 *
 * <p>Both plan formats are accepted. Attribute values of the XML format are
 * read as strings.
 */
public class QueryPlanDecoder {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    /**
     * Decodes an interchange document.
     *
     * @param document the document text
     * @return the decoded plan
     * @throws PlanEncodingException if the text is not an interchange document
     */
    public EncodedQueryPlan decode(String document) {
        JsonNode root;
        try {
            root = objectMapper.readTree(document);
        } catch (JsonProcessingException e) {
            throw new PlanEncodingException("Encoded plan is not valid JSON", e);
        }
        JsonNode text = root.get(SerdesKeys.QUERY_TEXT);
        JsonNode plan = root.get(SerdesKeys.QUERY_PLAN);
        if (text == null || plan == null) {
            throw new PlanEncodingException("Encoded plan lacks '" + SerdesKeys.QUERY_TEXT
                + "' or '" + SerdesKeys.QUERY_PLAN + "'");
        }
        EncodedPlanNode decoded = plan.isTextual() ? decodeXml(plan.textValue()) : decodeJson(plan);
        return new EncodedQueryPlan(text.asText(), decoded);
    }

    private EncodedPlanNode decodeJson(JsonNode node) {
        JsonNode label = node.get(SerdesKeys.LABEL);
        if (label == null || !label.isTextual()) {
            throw new PlanEncodingException("Encoded node lacks '" + SerdesKeys.LABEL + "'");
        }

        Map<String, Object> attrs = new LinkedHashMap<>();
        JsonNode encodedAttrs = node.path(SerdesKeys.ATTRS);
        Iterator<Map.Entry<String, JsonNode>> fields = encodedAttrs.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            attrs.put(field.getKey(), scalar(field.getValue()));
        }

        List<EncodedPlanNode> children = new ArrayList<>();
        for (JsonNode child : node.path(SerdesKeys.CHILDREN)) {
            children.add(decodeJson(child));
        }
        return new EncodedPlanNode(label.textValue(), attrs, children);
    }

    private static Object scalar(JsonNode value) {
        if (value.isIntegralNumber()) {
            return value.longValue();
        }
        if (value.isNumber()) {
            return value.doubleValue();
        }
        if (value.isBoolean()) {
            return value.booleanValue();
        }
        return value.asText();
    }

    private EncodedPlanNode decodeXml(String xml) {
        Element root;
        try {
            root = DocumentBuilderFactory.newInstance().newDocumentBuilder()
                .parse(new InputSource(new StringReader(xml)))
                .getDocumentElement();
        } catch (ParserConfigurationException | SAXException | IOException e) {
            throw new PlanEncodingException("Encoded plan is not valid XML", e);
        }
        return decodeElement(root);
    }

    private EncodedPlanNode decodeElement(Element element) {
        Map<String, Object> attrs = new LinkedHashMap<>();
        NamedNodeMap attributes = element.getAttributes();
        for (int i = 0; i < attributes.getLength(); i++) {
            Attr attr = (Attr) attributes.item(i);
            attrs.put(attr.getName(), attr.getValue());
        }

        List<EncodedPlanNode> children = new ArrayList<>();
        NodeList nodes = element.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node child = nodes.item(i);
            if (child.getNodeType() == Node.ELEMENT_NODE) {
                children.add(decodeElement((Element) child));
            }
        }
        return new EncodedPlanNode(element.getTagName(), attrs, children);
    }
}
