package com.landscape.connect.audit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.landscape.connect.testutil.LandscapeFixtures.id;
import static org.junit.jupiter.api.Assertions.*;

class MergeLedgerTest {

    private MergeLedger ledger;

    @BeforeEach
    void setUp() {
        ledger = new MergeLedger();
    }

    @Test
    @DisplayName("Should record merge operations")
    void testRecordMerge() {
        MergeRecord record = ledger.recordMerge(id(1), id(2), 0.01, "alignment", "identical structures");

        assertEquals(1, ledger.size());
        assertEquals(id(1), record.keepMinimumId());
        assertEquals(id(2), record.dropMinimumId());
        assertEquals(0.01, record.distance());
        assertNotNull(record.id());
        assertNotNull(record.timestamp());
    }

    @Test
    @DisplayName("Should allow an unknown distance")
    void testUnknownDistance() {
        MergeRecord record = ledger.recordMerge(id(1), id(2), null, "driver", "reported duplicate");

        assertNull(record.distance());
    }

    @Test
    @DisplayName("Should get records by kept minimum")
    void testGetRecordsForKeep() {
        ledger.recordMerge(id(1), id(2), null, "driver", "dup");
        ledger.recordMerge(id(1), id(3), null, "driver", "dup");
        ledger.recordMerge(id(4), id(5), null, "driver", "dup");

        assertEquals(2, ledger.getRecordsForKeep(id(1)).size());
        assertEquals(3, ledger.getAllRecords().size());
    }

    @Test
    @DisplayName("Should follow merges to the current canonical minimum")
    void testResolveCanonical() {
        ledger.recordMerge(id(2), id(3), null, "driver", "dup");
        ledger.recordMerge(id(1), id(2), null, "driver", "dup");

        assertEquals(id(1), ledger.resolveCanonical(id(3)));
        assertEquals(id(1), ledger.resolveCanonical(id(1)));
        assertEquals(id(9), ledger.resolveCanonical(id(9)));
    }

    @Test
    @DisplayName("Should report a merge cycle")
    void testCycle() {
        ledger.recordMerge(id(1), id(2), null, "driver", "dup");
        ledger.recordMerge(id(2), id(1), null, "driver", "dup");

        assertThrows(IllegalStateException.class, () -> ledger.resolveCanonical(id(1)));
    }

    @Test
    @DisplayName("Should collect the transitive merge chain")
    void testMergeChain() {
        ledger.recordMerge(id(2), id(3), null, "driver", "dup");
        ledger.recordMerge(id(1), id(2), null, "driver", "dup");

        assertEquals(List.of(id(2), id(3)), ledger.getMergeChain(id(1)));
    }

    @Test
    @DisplayName("Records require both minima")
    void testValidation() {
        assertThrows(NullPointerException.class, () -> MergeRecord.builder().keepMinimumId(id(1)).build());
    }
}
