package co.fanki.codereview.review.domain;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for {@link CodeUnit} and {@link ContentFingerprint}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class CodeUnitTest {

    @Test
    void whenFingerprinting_givenKnownContent_shouldReturnSha256Hex() {
        assertEquals(
                "ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad",
                ContentFingerprint.of("abc").value());
    }

    @Test
    void whenCreatingUnits_givenSameContentDifferentPaths_shouldShareFingerprintOnly() {
        final CodeUnit a = CodeUnit.of("a.py", "print(1)", null);
        final CodeUnit b = CodeUnit.of("b.py", "print(1)", null);

        assertEquals(a.fingerprint(), b.fingerprint());
        assertNotEquals(a, b);
    }

    @Test
    void whenCreatingUnit_givenOneByteChange_shouldChangeFingerprint() {
        final CodeUnit a = CodeUnit.of("a.py", "x = 1", null);
        final CodeUnit b = CodeUnit.of("a.py", "x = 2", null);

        assertNotEquals(a.fingerprint(), b.fingerprint());
        assertNotEquals(a, b);
    }

    @Test
    void whenCreatingUnit_givenNoLanguage_shouldDetectFromExtension() {
        assertEquals("python", CodeUnit.of("app/main.py", "x", null).language());
        assertEquals("typescript", CodeUnit.of("web/App.tsx", "x", "").language());
        assertEquals("unknown", CodeUnit.of("Makefile", "x", null).language());
        assertEquals("go", CodeUnit.of("main.py", "x", "Go").language());
    }

    @Test
    void whenMeasuring_givenMultiByteContent_shouldCountUtf8Bytes() {
        final CodeUnit unit = CodeUnit.of("a.txt", "ñ\nb", null);

        assertEquals(4, unit.size());
        assertEquals(2, unit.lineCount());
    }

    @Test
    void whenParsingFingerprint_givenMalformedHex_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> ContentFingerprint.fromHex("xyz"));
    }

}
