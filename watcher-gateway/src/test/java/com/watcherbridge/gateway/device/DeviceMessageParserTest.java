package com.watcherbridge.gateway.device;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.watcherbridge.common.error.ProtocolException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DeviceMessageParserTest {

    private final DeviceMessageParser parser = new DeviceMessageParser(new ObjectMapper());

    @Test
    void decodesKnownTypes() {
        assertInstanceOf(DeviceMessage.Hello.class, parser.parse("{\"type\":\"hello\",\"version\":1}"));

        DeviceMessage.Listen listen = (DeviceMessage.Listen) parser.parse("{\"type\":\"listen\",\"state\":\"start\"}");
        assertTrue(listen.opensTurn());
        assertFalse(((DeviceMessage.Listen) parser.parse("{\"type\":\"listen\",\"state\":\"stop\"}")).opensTurn());

        DeviceMessage.Audio audio = (DeviceMessage.Audio) parser.parse(
                "{\"type\":\"audio\",\"payload\":{\"data\":\"0a0BfF\"}}");
        assertArrayEquals(new byte[]{0x0a, 0x0b, (byte) 0xff}, audio.data());

        DeviceMessage.Mcp mcp = (DeviceMessage.Mcp) parser.parse("{\"type\":\"mcp\",\"payload\":{\"id\":7}}");
        assertEquals(7, mcp.payload().get("id").asInt());

        DeviceMessage button = parser.parse("{\"type\":\"button\",\"payload\":{\"pressed\":true}}");
        assertInstanceOf(DeviceMessage.Informational.class, button);
        assertEquals("button", button.type());
    }

    @Test
    void missingDataIsAnEmptyFrame() {
        DeviceMessage.Image image = (DeviceMessage.Image) parser.parse("{\"type\":\"image\"}");
        assertEquals(0, image.data().length);
    }

    @Test
    void unknownTypeIsUnrecognized() {
        DeviceMessage message = parser.parse("{\"type\":\"teleport\",\"x\":1}");
        assertInstanceOf(DeviceMessage.Unrecognized.class, message);
        assertEquals("teleport", message.type());
    }

    @Test
    void rejectsMalformedInput() {
        assertThrows(ProtocolException.class, () -> parser.parse("{oops"));
        assertThrows(ProtocolException.class, () -> parser.parse("\"just a string\""));
        assertThrows(ProtocolException.class, () -> parser.parse("{\"type\":\"audio\",\"payload\":{\"data\":\"abc\"}}"));
    }
}
