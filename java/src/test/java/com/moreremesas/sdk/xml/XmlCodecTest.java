package com.moreremesas.sdk.xml;

import com.moreremesas.sdk.internal.Xml;
import org.junit.jupiter.api.Test;
import org.w3c.dom.Element;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class XmlCodecTest {

    private final XmlCodec codec = new XmlCodec(ForceListRegistry.defaults());

    @Test
    void encodesFieldsInInsertionOrder() {
        Fields request = Fields.of("PayoutCountry", "HT", "Amount", "100.00", "Currency", "USD");

        assertEquals(
            "<mmt:Req><mmt:PayoutCountry>HT</mmt:PayoutCountry><mmt:Amount>100.00</mmt:Amount>"
                + "<mmt:Currency>USD</mmt:Currency></mmt:Req>",
            codec.encode(request, "Req"));
    }

    @Test
    void encodesWithoutWrapperWhenNameIsMissing() {
        assertEquals("<mmt:A>1</mmt:A><mmt:B>2</mmt:B>", codec.encode(Fields.of("A", "1", "B", "2"), null));
        assertEquals("", codec.encode(null, null));
    }

    @Test
    void escapesAllSpecialCharacters() throws Exception {
        String encoded = codec.encode(XmlValue.text("a&b<c>d\"e'f"), "Note");
        assertEquals("<mmt:Note>a&amp;b&lt;c&gt;d&quot;e&apos;f</mmt:Note>", encoded);

        Element root = parse("<mmt:Root xmlns:mmt=\"MMT\">" + encoded + "</mmt:Root>");
        assertEquals("a&b<c>d\"e'f", codec.decode(root).asFields().getText("Note"));
    }

    @Test
    void nullValueEncodesAsEmptyElement() {
        Fields fields = new Fields().put("MiddleName", (String) null).put("LastName", "DOE");
        assertEquals("<mmt:MiddleName></mmt:MiddleName><mmt:LastName>DOE</mmt:LastName>", codec.encode(fields, null));
    }

    @Test
    void listRepeatsElementNamePerItem() {
        Fields fields = new Fields().put("Tax", XmlValue.list(List.of(
            Fields.of("Code", "IVA"),
            Fields.of("Code", "ISR"))));

        assertEquals(
            "<mmt:Tax><mmt:Code>IVA</mmt:Code></mmt:Tax><mmt:Tax><mmt:Code>ISR</mmt:Code></mmt:Tax>",
            codec.encode(fields, null));
    }

    @Test
    void repeatedSiblingsBecomeListInDocumentOrder() throws Exception {
        Element root = parse("<Response><Item>a</Item><Other>x</Other><Item>b</Item><Item>c</Item></Response>");

        Fields decoded = codec.decode(root).asFields();

        List<XmlValue> items = decoded.get("Item").asList();
        assertEquals(List.of("a", "b", "c"), items.stream().map(XmlValue::asText).toList());
        assertEquals("x", decoded.getText("Other"));
    }

    @Test
    void singleForcedChildIsExposedAsList() throws Exception {
        Element root = parse("<Response><ResponseCode>1000</ResponseCode>"
            + "<Options><Option><Id>7</Id><Rate>89.5</Rate></Option></Options></Response>");

        Fields decoded = codec.decode(root).asFields();
        XmlValue options = decoded.getFields("Options").get("Option");

        assertTrue(options.isList());
        assertEquals(1, options.asList().size());
        assertEquals("7", options.asList().get(0).asFields().getText("Id"));
    }

    @Test
    void emptyForcedChildBecomesEmptyList() throws Exception {
        Element root = parse("<Response><Messages><Message/></Messages></Response>");

        XmlValue messages = codec.decode(root).asFields().getFields("Messages").get("Message");

        assertTrue(messages.isList());
        assertTrue(messages.asList().isEmpty());
    }

    @Test
    void forceRulesOnlyApplyUnderTheirParent() throws Exception {
        Element root = parse("<Response><Option><Id>1</Id></Option></Response>");

        XmlValue option = codec.decode(root).asFields().get("Option");

        assertTrue(option.isFields());
    }

    @Test
    void emptyRegistryLeavesSingletonsAlone() throws Exception {
        XmlCodec plain = new XmlCodec(ForceListRegistry.empty());
        Element root = parse("<Response><Branches><Branch><Id>1</Id></Branch></Branches></Response>");

        assertTrue(plain.decode(root).asFields().getFields("Branches").get("Branch").isFields());
    }

    @Test
    void namespacePrefixesAreStripped() throws Exception {
        Element root = parse("<m:Response xmlns:m=\"MMT\" xmlns:o=\"urn:other\">"
            + "<m:ResponseCode> 1000 </m:ResponseCode><o:Extra>y</o:Extra></m:Response>");

        Fields decoded = codec.decode(root).asFields();

        assertEquals("1000", decoded.getText("ResponseCode"));
        assertEquals("y", decoded.getText("Extra"));
    }

    @Test
    void decodedTreeMatchesEncodedInput() throws Exception {
        Fields request = new Fields()
            .put("OrderDate", "2024-05-01")
            .put("Customer", Fields.of("FirstName", "JEAN", "LastName", "O'NEIL & SONS"))
            .put("Tag", XmlValue.list(List.of(XmlValue.text("a"), XmlValue.text("b"))));

        String xml = "<mmt:Root xmlns:mmt=\"MMT\">" + codec.encode(request, null) + "</mmt:Root>";
        XmlValue decoded = codec.decode(parse(xml));

        assertEquals(request, decoded);
    }

    @Test
    void emptyNestedFieldsDecodeAsEmptyText() throws Exception {
        Fields request = new Fields().put("Address", new Fields()).put("X", "1");

        String xml = "<mmt:Root xmlns:mmt=\"MMT\">" + codec.encode(request, null) + "</mmt:Root>";
        Fields decoded = codec.decode(parse(xml)).asFields();

        assertEquals("<mmt:Address></mmt:Address><mmt:X>1</mmt:X>", codec.encode(request, null));
        assertEquals("", decoded.getText("Address"));
        assertEquals("1", decoded.getText("X"));
    }

    @Test
    void scalarPayloadIsWrappedUnderTextKey() throws Exception {
        Fields decoded = codec.decodePayload(parse("<Response> OK </Response>"));

        assertEquals("OK", decoded.getText(XmlCodec.TEXT_KEY));
        assertEquals(1, decoded.size());
    }

    private static Element parse(String xml) throws Exception {
        return Xml.parse(xml.getBytes(StandardCharsets.UTF_8)).getDocumentElement();
    }
}
