package org.opstranslate.vro.errorhandling;

import org.junit.jupiter.api.Test;
import org.opstranslate.vro.errorhandling.models.ErrorHandlingBlock;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ErrorHandlingExtractorTest {

    @Test
    void shouldExtractTryCatchFinally() {
        String script = "prepare();\n"
                + "try {\n  deploy(vm);\n} catch (e) {\n  System.error(\"failed\");\n  throw e;\n} finally {\n  cleanup();\n}\n"
                + "done();";

        ErrorHandlingBlock block = ErrorHandlingExtractor.extract(script).orElseThrow();

        assertEquals("deploy(vm);", block.tryBody());
        assertEquals("e", block.catchVar());
        assertEquals("System.error(\"failed\");\n  throw e;", block.catchBody());
        assertEquals("cleanup();", block.finallyBody());
        assertEquals(script.indexOf("try"), block.tryStart());
        assertEquals(script.indexOf("\ndone();"), block.end());
        assertTrue(block.hasCatch());
        assertTrue(block.hasFinally());
    }

    @Test
    void shouldExtractBareTryFinally() {
        String script = "try { work(); } finally { release(); }";

        ErrorHandlingBlock block = ErrorHandlingExtractor.extract(script).orElseThrow();

        assertFalse(block.hasCatch());
        assertNull(block.catchVar());
        assertEquals("release();", block.finallyBody());
        assertEquals(script.length(), block.end());
    }

    @Test
    void shouldExtractCatchWithoutBinding() {
        ErrorHandlingBlock block = ErrorHandlingExtractor.extract("try { a(); } catch { b(); }").orElseThrow();

        assertNull(block.catchVar());
        assertEquals("b();", block.catchBody());
        assertFalse(block.hasFinally());
    }

    @Test
    void shouldIgnoreBracesInsideStrings() {
        String script = "try { System.log(\"}\"); } catch (err) { System.log(\"{ oops\"); }";

        ErrorHandlingBlock block = ErrorHandlingExtractor.extract(script).orElseThrow();

        assertEquals("System.log(\"}\");", block.tryBody());
        assertEquals("System.log(\"{ oops\");", block.catchBody());
    }

    @Test
    void shouldReturnEmptyWithoutHandlers() {
        assertEquals(Optional.empty(), ErrorHandlingExtractor.extract("work();"));
        assertEquals(Optional.empty(), ErrorHandlingExtractor.extract("try { work(); }"));
        assertEquals(Optional.empty(), ErrorHandlingExtractor.extract("try { work(); } catch (e) { oops();"));
        assertEquals(Optional.empty(), ErrorHandlingExtractor.extract(null));
    }
}
