package fleetportal.core.api.v1.dto;

import fleetportal.core.model.InstanceSpec;
import fleetportal.core.server.RouterHandler;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CreateInstanceRequestTest {

    @Test
    void missingSizesUseDefaults() throws Exception {
        CreateInstanceRequest request = RouterHandler.mapper()
                .readValue("{\"name\":\"dev\"}", CreateInstanceRequest.class);

        InstanceSpec spec = request.toSpec();
        assertEquals("dev", spec.name());
        assertEquals(1, spec.cpu());
        assertEquals(2, spec.memoryGb());
        assertEquals(InstanceSpec.DEFAULT_IMAGE, spec.image());
    }

    @Test
    void memoryAliasIsAccepted() throws Exception {
        CreateInstanceRequest request = RouterHandler.mapper()
                .readValue("{\"name\":\"dev\",\"cpu\":4,\"memory\":8,\"image\":\"python:3.12\","
                        + "\"env\":{\"A\":\"1\"}}", CreateInstanceRequest.class);

        InstanceSpec spec = request.toSpec();
        assertEquals(4, spec.cpu());
        assertEquals(8, spec.memoryGb());
        assertEquals("python:3.12", spec.image());
        assertEquals(Map.of("A", "1"), spec.env());
    }
}
