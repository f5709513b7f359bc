package com.conveyal.viewshed.analyst;

import com.conveyal.viewshed.error.ViewshedCancelledException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CancellationTokenTest {

    @Test
    void cancelIsVisibleToChecks () {
        CancellationToken token = new CancellationToken();
        assertFalse(token.isCancelled());
        assertDoesNotThrow(token::throwIfCancelled);
        token.cancel();
        assertTrue(token.isCancelled());
        assertThrows(ViewshedCancelledException.class, token::throwIfCancelled);
    }

    @Test
    void sharedTokenCannotBeCancelled () {
        assertThrows(UnsupportedOperationException.class, CancellationToken.NONE::cancel);
        assertFalse(CancellationToken.NONE.isCancelled());
    }

}
