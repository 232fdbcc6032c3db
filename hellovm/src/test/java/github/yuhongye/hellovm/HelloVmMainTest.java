package github.yuhongye.hellovm;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

import static org.junit.Assert.assertEquals;

public class HelloVmMainTest {
    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private final ByteArrayOutputStream bos = new ByteArrayOutputStream();
    private final PrintStream out = new PrintStream(bos, true);

    @Test
    public void testRun() throws IOException {
        File classFile = write(ClassFileBuilder.helloWorld("Hello, World!", ClassFileBuilder.RETURN).build());
        int status = HelloVmMain.run(out, classFile.getPath(), "--expect-this=Main", "--dump");
        assertEquals(HelloVmMain.EXIT_OK, status);
        assertEquals("Hello, World!" + System.lineSeparator(), new String(bos.toByteArray(), StandardCharsets.UTF_8));
    }

    @Test
    public void testSanityChecks() throws IOException {
        File classFile = write(ClassFileBuilder.helloWorld("x").build());
        assertEquals(HelloVmMain.EXIT_FAILURE, HelloVmMain.run(out, classFile.getPath(), "--expect-this=Other"));
        assertEquals(HelloVmMain.EXIT_FAILURE, HelloVmMain.run(out, classFile.getPath(), "--expect-super=java/lang/Thread"));

        File badMagic = write(ClassFileBuilder.helloWorld("x").magic(0xDEADBEEF).build());
        assertEquals(HelloVmMain.EXIT_FAILURE, HelloVmMain.run(out, badMagic.getPath()));
        assertEquals(0, bos.size());
    }

    @Test
    public void testFailures() throws IOException {
        File noInterfaces = write(ClassFileBuilder.helloWorld("x").interfacesCount(1).build());
        assertEquals(HelloVmMain.EXIT_FAILURE, HelloVmMain.run(out, noInterfaces.getPath()));

        File missing = new File(folder.getRoot(), "Missing.class");
        assertEquals(HelloVmMain.EXIT_FAILURE, HelloVmMain.run(out, missing.getPath()));

        File classFile = write(ClassFileBuilder.helloWorld("x").build());
        assertEquals(HelloVmMain.EXIT_FAILURE, HelloVmMain.run(out, classFile.getPath(), "--entry=start"));
    }

    @Test
    public void testUsage() {
        assertEquals(HelloVmMain.EXIT_USAGE, HelloVmMain.run(out));
        assertEquals(HelloVmMain.EXIT_USAGE, HelloVmMain.run(out, "A.class", "--verbose"));
        assertEquals(HelloVmMain.EXIT_USAGE, HelloVmMain.run(out, "A.class", "B.class"));
    }

    private File write(byte[] bytes) throws IOException {
        File file = folder.newFile();
        Files.write(file.toPath(), bytes);
        return file;
    }
}
