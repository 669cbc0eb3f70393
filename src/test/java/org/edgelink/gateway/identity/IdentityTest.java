package org.edgelink.gateway.identity;

import org.junit.Assert;
import org.junit.Test;

public class IdentityTest {

    @Test
    public void testDevice() {
        DeviceIdentity identity = new DeviceIdentity("d1");
        Assert.assertEquals("d1", identity.getId());
        Assert.assertEquals("d1", identity.getDeviceId());
        Assert.assertEquals(new DeviceIdentity("d1"), identity);
    }

    @Test
    public void testModule() {
        ModuleIdentity identity = new ModuleIdentity("d1", "m1");
        Assert.assertEquals("d1/m1", identity.getId());
        Assert.assertEquals("d1", identity.getDeviceId());
        Assert.assertEquals("m1", identity.getModuleId());
        Assert.assertEquals(new ModuleIdentity("d1", "m1"), identity);
        Assert.assertNotEquals(new ModuleIdentity("d1", "m2"), identity);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testEmptyModuleId() {
        new ModuleIdentity("d1", "");
    }

    @Test(expected = NullPointerException.class)
    public void testNullDeviceId() {
        new DeviceIdentity(null);
    }
}
