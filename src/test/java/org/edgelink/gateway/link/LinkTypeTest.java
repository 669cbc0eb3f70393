package org.edgelink.gateway.link;

import org.junit.Assert;
import org.junit.Test;

public class LinkTypeTest {

    @Test
    public void testPairsAreSymmetric() {
        for (LinkType type : LinkType.values()) {
            type.pair().ifPresent(paired -> {
                Assert.assertNotEquals(type, paired);
                Assert.assertEquals(type, paired.pair().orElse(null));
            });
        }
        Assert.assertEquals(LinkType.METHOD_RECEIVING, LinkType.METHOD_SENDING.pair().orElse(null));
        Assert.assertEquals(LinkType.TWIN_SENDING, LinkType.TWIN_RECEIVING.pair().orElse(null));
    }

    @Test
    public void testUnpairedTypes() {
        Assert.assertFalse(LinkType.C2D.pair().isPresent());
        Assert.assertFalse(LinkType.MODULE_MESSAGES.pair().isPresent());
        Assert.assertFalse(LinkType.EVENTS.pair().isPresent());
        Assert.assertFalse(LinkType.CBS.pair().isPresent());
    }

    @Test
    public void testSending() {
        Assert.assertTrue(LinkType.C2D.isSending());
        Assert.assertTrue(LinkType.MODULE_MESSAGES.isSending());
        Assert.assertTrue(LinkType.METHOD_SENDING.isSending());
        Assert.assertTrue(LinkType.TWIN_SENDING.isSending());
        Assert.assertFalse(LinkType.METHOD_RECEIVING.isSending());
        Assert.assertFalse(LinkType.TWIN_RECEIVING.isSending());
        Assert.assertFalse(LinkType.EVENTS.isSending());
    }
}
