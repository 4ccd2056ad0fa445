package io.skipkp.capability;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class GlobPatternTest {

    @Test
    void starMatchesAnyRunIncludingEmpty() {
        GlobPattern p = GlobPattern.compile("KP_*_Test");
        Assertions.assertTrue(p.matches("KP_Alpha_Test"));
        Assertions.assertTrue(p.matches("KP__Test"));
        Assertions.assertFalse(p.matches("KP_Alpha_Prod"));
        Assertions.assertFalse(p.matches("xKP_Alpha_Test"));
    }

    @Test
    void questionMarkMatchesExactlyOneCharacter() {
        GlobPattern p = GlobPattern.compile("KP_Node?");
        Assertions.assertTrue(p.matches("KP_Node1"));
        Assertions.assertFalse(p.matches("KP_Node"));
        Assertions.assertFalse(p.matches("KP_Node12"));
    }

    @Test
    void characterClassesAndNegation() {
        Assertions.assertTrue(GlobPattern.compile("KP_[ab]").matches("KP_a"));
        Assertions.assertFalse(GlobPattern.compile("KP_[ab]").matches("KP_c"));
        Assertions.assertTrue(GlobPattern.compile("KP_[0-9]").matches("KP_7"));
        Assertions.assertTrue(GlobPattern.compile("KP_[!0-9]").matches("KP_x"));
        Assertions.assertFalse(GlobPattern.compile("KP_[!0-9]").matches("KP_7"));
    }

    @Test
    void regexMetacharactersAreLiteral() {
        GlobPattern p = GlobPattern.compile("KP.(1)+");
        Assertions.assertTrue(p.matches("KP.(1)+"));
        Assertions.assertFalse(p.matches("KPx(1)"));
        Assertions.assertTrue(GlobPattern.compile("KP_[open").matches("KP_[open"));
    }

    @Test
    void matchingIsCaseSensitive() {
        Assertions.assertFalse(GlobPattern.compile("KP_QuIIN_Client").matches("kp_quiin_client"));
        Assertions.assertFalse(GlobPattern.compile("KP_Development_*").matches("KP_development_x"));
    }

    @Test
    void emptyGlobIsRejected() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> GlobPattern.compile(""));
    }
}
