package perf.report.reporter.deobfuscate;

import org.junit.Assert;
import org.junit.Test;
import perf.report.common.exception.ConfigurationException;
import perf.report.reporter.Fixtures;

import java.io.IOException;
import java.io.StringReader;
import java.util.Optional;

public class ProguardMappingFileTest {

    @Test
    public void testMethodsAreDeobfuscated() {
        ProguardMappingFile mapping = ProguardMappingFile.load(Fixtures.resource("mapping.txt"));
        Assert.assertEquals(2, mapping.getClassCount());
        Assert.assertEquals(Optional.of("com.example.Worker.run"), mapping.deobfuscate("a.b.a"));
        Assert.assertEquals(Optional.of("com.example.Worker.isIdle"), mapping.deobfuscate("a.b.c"));
        Assert.assertEquals(Optional.of("com.example.Scheduler.schedule"), mapping.deobfuscate("a.c.a"));
    }

    @Test
    public void testArgumentListIsKept() {
        ProguardMappingFile mapping = ProguardMappingFile.load(Fixtures.resource("mapping.txt"));
        Assert.assertEquals(Optional.of("com.example.Scheduler.schedule(a.b, long)"), mapping.deobfuscate("a.c.a(a.b, long)"));
    }

    @Test
    public void testFieldsAreNotMethods() {
        ProguardMappingFile mapping = ProguardMappingFile.load(Fixtures.resource("mapping.txt"));
        // 'b' only names a field of a.b
        Assert.assertEquals(Optional.of("com.example.Worker.b"), mapping.deobfuscate("a.b.b"));
    }

    @Test
    public void testUnknownClassesAreNotTouched() {
        ProguardMappingFile mapping = ProguardMappingFile.load(Fixtures.resource("mapping.txt"));
        Assert.assertFalse(mapping.deobfuscate("x.y.z").isPresent());
        Assert.assertFalse(mapping.deobfuscate("__libc_init").isPresent());
        Assert.assertFalse(mapping.deobfuscate("a.b").isPresent());
    }

    @Test(expected = ConfigurationException.class)
    public void testMemberBeforeClassIsRejected() throws IOException {
        ProguardMappingFile.parse(new StringReader("    void run() -> a\n"), "inline");
    }

    @Test(expected = ConfigurationException.class)
    public void testMalformedClassLineIsRejected() throws IOException {
        ProguardMappingFile.parse(new StringReader("com.example.Worker a.b\n"), "inline");
    }

    @Test(expected = ConfigurationException.class)
    public void testMissingFileIsRejected() {
        ProguardMappingFile.load(Fixtures.resource("mapping.txt").resolveSibling("no-such-mapping.txt"));
    }
}
