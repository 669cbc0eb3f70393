package org.edgelink.gateway.message;

import org.junit.Assert;
import org.junit.Test;

public class MethodRequestTest {

    @Test
    public void testToMessage() {
        MethodRequest request = new MethodRequest("c1", "restart", null);
        Message message = request.toMessage();

        Assert.assertEquals(0, message.getBody().length);
        Assert.assertEquals("restart", message.getProperty(MethodRequest.METHOD_NAME_PROPERTY));
        Assert.assertEquals("c1", message.getSystemProperty(SystemProperties.CORRELATION_ID));
        Assert.assertNull(message.getSystemProperty(SystemProperties.TO));
    }
}
