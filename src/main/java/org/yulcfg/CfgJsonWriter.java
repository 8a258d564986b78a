package org.yulcfg;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/** Pretty-printed output of exported documents. */
public class CfgJsonWriter {

    private final ObjectMapper om;

    public CfgJsonWriter(ObjectMapper om) {
        this.om = om;
    }

    public CfgJsonWriter() {
        this(new ObjectMapper());
    }

    public String writeString(JsonNode document) throws IOException {
        return om.writerWithDefaultPrettyPrinter().writeValueAsString(document);
    }

    public void write(JsonNode document, Path out) throws IOException {
        Path parent = out.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        om.writerWithDefaultPrettyPrinter().writeValue(out.toFile(), document);
        System.out.println("Done: " + out);
    }
}
