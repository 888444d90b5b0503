package com.eyelevel.labmigrator.support;

import com.eyelevel.labmigrator.model.element.DataElement;
import com.eyelevel.labmigrator.model.element.DataItem;
import com.eyelevel.labmigrator.model.element.Element;
import com.eyelevel.labmigrator.model.element.FileElement;
import com.eyelevel.labmigrator.model.element.ImageElement;
import com.eyelevel.labmigrator.model.element.TableElement;
import com.eyelevel.labmigrator.model.element.TextElement;
import com.eyelevel.labmigrator.model.element.UnsupportedElement;
import com.eyelevel.labmigrator.model.element.WellPlateElement;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;

import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

public final class SampleElements {

    public static final String SPREADJS_TWO_SHEETS = """
            {"sheets": {
              "Results": {"rowCount": 3, "columnCount": 2, "data": {"dataTable": {
                "0": {"0": {"value": "Sample"}, "1": {"value": "OD"}},
                "1": {"0": {"value": "A1"}, "1": {"value": 0.42}},
                "2": {"0": {"value": "A2"}, "1": {"value": 1.5}}}}},
              "Notes": {"data": {"dataTable": {"0": {"0": {"value": "ok"}}}}}
            }}""";

    private SampleElements() {
    }

    public static JsonNode json(String json) {
        try {
            return TestEntries.OBJECT_MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static TextElement text(String id) {
        return new TextElement(id, "<p>Hello <b>world</b></p>");
    }

    public static TableElement table(String id) {
        return new TableElement(id, "Plate reader", json(SPREADJS_TWO_SHEETS));
    }

    public static WellPlateElement delimitedWellPlate(String id) {
        return new WellPlateElement(id, "Plate", new TextNode("well;value\nA1;3\nA2;4"));
    }

    public static DataElement data(String id) {
        return new DataElement(id, List.of(
                new DataItem("SINGLE_DATA_ELEMENT", "Temperature", "37", "°C", null),
                new DataItem("DATA_ELEMENT_GROUP", "Buffer", null, null, List.of(
                        new DataItem("SINGLE_DATA_ELEMENT", "pH", "7.4", null, null)))));
    }

    public static FileElement file(String id) {
        return new FileElement(id, "protocol.pdf", "application/pdf", "%PDF-1.4".getBytes(StandardCharsets.UTF_8));
    }

    public static ImageElement image(String id) {
        return new ImageElement(id, "gel.png", "image/png", new byte[]{(byte) 0x89, 'P', 'N', 'G'});
    }

    public static UnsupportedElement sketch(String id) {
        return new UnsupportedElement(id, "SKETCH");
    }

    public static List<Element> allKinds() {
        return List.of(text("t1"), table("tb1"), delimitedWellPlate("w1"), data("d1"), file("f1"), image("i1"),
                       sketch("s1"));
    }
}
