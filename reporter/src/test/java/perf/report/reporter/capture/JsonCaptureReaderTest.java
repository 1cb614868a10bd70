package perf.report.reporter.capture;

import org.junit.Assert;
import org.junit.Test;
import perf.report.common.exception.ConfigurationException;
import perf.report.common.sample.Frame;
import perf.report.common.sample.Sample;
import perf.report.common.symbol.SymbolTable;
import perf.report.reporter.Fixtures;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;

public class JsonCaptureReaderTest {

    @Test
    public void testSymbolsAreRead() throws IOException {
        JsonCaptureReader reader = new JsonCaptureReader(Fixtures.resource("captures/app.json"));
        SymbolTable symbols = reader.getSymbols();

        Assert.assertEquals("cpu-clock:u", symbols.getEventTypeName(0));
        Assert.assertEquals("/system/lib64/libart.so", symbols.getLibraryName(1));
        Assert.assertEquals("a.b.a", symbols.getFunction(2).getName());
        Assert.assertEquals(2, symbols.getFunction(2).getLibId());
        Assert.assertEquals("com.example.app", symbols.getProcessName(10));
        Assert.assertEquals("Worker", symbols.getThread(11).getName());
        Assert.assertEquals(10, symbols.getThread(11).getPid());
        Assert.assertSame(symbols, reader.getSymbols());
    }

    @Test
    public void testSamplesAreStreamedInFileOrder() throws IOException {
        List<Sample> samples = new ArrayList<>();
        new JsonCaptureReader(Fixtures.resource("captures/app.json")).readSamples(samples::add);

        Assert.assertEquals(3, samples.size());
        Sample first = samples.get(0);
        Assert.assertEquals(11, first.getTid());
        Assert.assertEquals(10, first.getPid());
        Assert.assertEquals(1000, first.getTimestamp());
        Assert.assertEquals(5, first.getPeriod());
        Assert.assertFalse(first.isOffCpu());
        Assert.assertEquals(3, first.getCallChain().size());

        Frame leaf = first.getLeaf();
        Assert.assertEquals(2, leaf.getLibId());
        Assert.assertEquals(2, leaf.getFunctionId());
        Assert.assertEquals(12288, leaf.getAddress());

        Assert.assertEquals(3000, samples.get(2).getTimestamp());
    }

    @Test
    public void testSectionsMayComeInAnyOrder() throws IOException {
        JsonCaptureReader reader = new JsonCaptureReader(Fixtures.resource("captures/second.json"));
        Assert.assertEquals("memcpy", reader.getSymbols().getFunction(3).getName());

        List<Sample> samples = new ArrayList<>();
        reader.readSamples(samples::add);
        Assert.assertEquals(1, samples.size());
        Assert.assertEquals(4, samples.get(0).getPeriod());
    }

    @Test
    public void testMalformedFrameNamesFileAndLine() throws IOException {
        try {
            new JsonCaptureReader(Fixtures.resource("captures/truncated.json")).readSamples(s -> { });
            Assert.fail("frame without an address was accepted");
        } catch (ConfigurationException e) {
            assertThat(e.getMessage(), containsString("truncated.json"));
            assertThat(e.getMessage(), containsString("line 4"));
        }
    }
}
