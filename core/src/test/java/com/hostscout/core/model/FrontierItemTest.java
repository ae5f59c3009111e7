package com.hostscout.core.model;

import org.junit.jupiter.api.Test;

import java.net.URI;

import static org.junit.jupiter.api.Assertions.*;

class FrontierItemTest {

    @Test
    void seed_child_and_next_page_track_depth_and_page() {
        FrontierItem seed = FrontierItem.seed(URI.create("https://s.test/?p=1"), "q1");
        assertEquals(1, seed.depth());
        assertEquals(1, seed.pageIndex());

        FrontierItem child = seed.child(URI.create("https://s.test/detail"));
        assertEquals(2, child.depth());
        assertEquals(1, child.pageIndex());
        assertEquals("q1", child.sourceTag());

        FrontierItem next = seed.nextPage(URI.create("https://s.test/?p=2"));
        assertEquals(2, next.depth());
        assertEquals(2, next.pageIndex());
    }

    @Test
    void rejects_zero_depth_or_page() {
        URI u = URI.create("https://s.test/");
        assertThrows(IllegalArgumentException.class, () -> new FrontierItem(u, 0, 1, "t", null));
        assertThrows(IllegalArgumentException.class, () -> new FrontierItem(u, 1, 0, "t", null));
        assertNotNull(new FrontierItem(u, 1, 1, "t", null).bornAt());
    }
}
