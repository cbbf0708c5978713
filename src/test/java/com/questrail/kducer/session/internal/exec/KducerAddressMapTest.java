package com.questrail.kducer.session.internal.exec;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * KducerAddressMapTest
 * -----------------------------------------------------------------------------
 * Tier boundaries and bank addressing.
 */
class KducerAddressMapTest {

    @Test
    void firmware37UsesLegacyTier() {
        KducerAddressMap map = KducerAddressMap.forVersion(37);

        assertEquals(KducerAddressMap.Tier.LEGACY, map.tier());
        assertEquals(64, map.maxProgram());
        assertEquals(180, map.programBytes());
        assertEquals(8, map.maxSequence());
        assertEquals(64, map.sequenceBytes());
        assertEquals(78, map.settingsBytes());
        assertFalse(map.hasSettingsSecondTranche());
    }

    @Test
    void firmware38UsesExtendedTier() {
        KducerAddressMap map = KducerAddressMap.forVersion(38);

        assertEquals(KducerAddressMap.Tier.EXTENDED, map.tier());
        assertEquals(200, map.maxProgram());
        assertEquals(230, map.programBytes());
        assertEquals(24, map.maxSequence());
        assertEquals(112, map.sequenceBytes());
        assertEquals(86, map.settingsBytes());
    }

    @Test
    void settingsSizeGrowsWithFirmware() {
        assertEquals(88, KducerAddressMap.forVersion(39).settingsBytes());
        assertEquals(92, KducerAddressMap.forVersion(40).settingsBytes());
        assertEquals(88, KducerAddressMap.forVersion(40).settingsFirstTrancheBytes());
        assertTrue(KducerAddressMap.forVersion(41).hasSettingsSecondTranche());
    }

    @Test
    void programBankIsContiguousPerTier() {
        KducerAddressMap legacy = KducerAddressMap.forVersion(37);
        KducerAddressMap extended = KducerAddressMap.forVersion(38);

        assertEquals(1000, legacy.programAddress(1));
        assertEquals(1090, legacy.programAddress(2));
        assertEquals(1115, extended.programAddress(2));
        assertEquals(25000 + 56 * 23, extended.sequenceAddress(24));
    }

    @Test
    void rejectsNumbersOutsideTier() {
        KducerAddressMap map = KducerAddressMap.forVersion(38);

        assertThrows(IllegalArgumentException.class, () -> map.requireProgram(0));
        assertThrows(IllegalArgumentException.class, () -> map.requireProgram(201));
        assertDoesNotThrow(() -> map.requireProgram(200));
        assertThrows(IllegalArgumentException.class, () -> KducerAddressMap.forVersion(37).requireProgram(65));
        assertThrows(IllegalArgumentException.class, () -> KducerAddressMap.forVersion(37).sequenceAddress(9));
    }
}
