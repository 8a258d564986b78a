package org.yulcfg;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Exports a whole Yul object tree. Each object's CFG goes through {@link CfgJsonExporter}
 * under "blocks"; sub-objects are nested by name.
 *
 * <pre>
 * { "C": { "blocks": [...], "subObjects": { "C_deployed": { "blocks": [...] }, "type": "subObject" } },
 *   "type": "Object" }
 * </pre>
 */
public class ObjectCfgExporter {

    private final ObjectMapper om;
    private final CfgJsonExporter cfgExporter;

    public ObjectCfgExporter(ObjectMapper om) {
        this.om = om;
        this.cfgExporter = new CfgJsonExporter(om);
    }

    public ObjectCfgExporter() {
        this(new ObjectMapper());
    }

    public ObjectNode export(YulObject object) {
        YulAssertion.check(!"type".equals(object.name), "reserved object name: " + object.name);
        ObjectNode root = om.createObjectNode();
        ObjectNode objectJson = exportObject(object);
        objectJson.set("subObjects", exportSubObjects(object));
        root.set(object.name, objectJson);
        root.put("type", "Object");
        return root;
    }

    private ObjectNode exportObject(YulObject object) {
        ObjectNode n = om.createObjectNode();
        n.set("blocks", cfgExporter.export(object.cfg));
        return n;
    }

    private ObjectNode exportSubObjects(YulObject parent) {
        ObjectNode subObjectsJson = om.createObjectNode();
        for (YulObject sub : parent.subObjects) {
            YulAssertion.check(!"type".equals(sub.name) && !subObjectsJson.has(sub.name),
                    "duplicate or reserved sub-object name in " + parent.name + ": " + sub.name);
            ObjectNode subJson = exportObject(sub);
            if (!sub.subObjects.isEmpty())
                subJson.set("subObjects", exportSubObjects(sub));
            subObjectsJson.set(sub.name, subJson);
        }
        if (!parent.subObjects.isEmpty())
            subObjectsJson.put("type", "subObject");
        return subObjectsJson;
    }
}
