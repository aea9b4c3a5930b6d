package backend.register;

import static org.junit.Assert.*;

import org.junit.Test;

public class RegisterManagerTest {

    @Test
    public void testLowestFreeRegister() {
        RegisterManager registers = new RegisterManager();
        assertEquals(1, registers.acquire());
        assertEquals(2, registers.acquire());
        registers.release(1);
        assertEquals(1, registers.acquire());
        assertEquals(3, registers.acquire());
        assertEquals(3, registers.getLiveNum());
        assertTrue(registers.isLive(2));
        assertEquals(3, registers.getPeak());
        assertEquals("R3", RegisterManager.getName(3));
    }

    @Test(expected = RuntimeException.class)
    public void testReleaseOfDeadRegister() {
        new RegisterManager().release(1);
    }
}
