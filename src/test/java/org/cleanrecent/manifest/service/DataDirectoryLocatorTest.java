package org.cleanrecent.manifest.service;

import org.junit.jupiter.api.Test;

import java.nio.file.Paths;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DataDirectoryLocatorTest {

    @Test
    void linuxPrefersAbsoluteXdgDataHome() {
        DataDirectoryLocator locator = new DataDirectoryLocator(
                Map.of("HOME", "/home/me", "XDG_DATA_HOME", "/xdg/data"), "Linux", "/ignored");
        assertEquals(Paths.get("/xdg/data"), locator.dataDirectory());
    }

    @Test
    void linuxFallsBackToLocalShare() {
        DataDirectoryLocator locator = new DataDirectoryLocator(Map.of("HOME", "/home/me"), "Linux", "/ignored");
        assertEquals(Paths.get("/home/me/.local/share"), locator.dataDirectory());
    }

    @Test
    void relativeXdgDataHomeIsIgnored() {
        DataDirectoryLocator locator = new DataDirectoryLocator(
                Map.of("HOME", "/home/me", "XDG_DATA_HOME", "relative/dir"), "FreeBSD", null);
        assertEquals(Paths.get("/home/me/.local/share"), locator.dataDirectory());
    }

    @Test
    void userHomePropertyUsedWithoutHomeVariable() {
        DataDirectoryLocator locator = new DataDirectoryLocator(Map.of(), "Linux", "/home/prop");
        assertEquals(Paths.get("/home/prop/.local/share"), locator.dataDirectory());
    }

    @Test
    void macUsesApplicationSupport() {
        DataDirectoryLocator locator = new DataDirectoryLocator(Map.of("HOME", "/Users/me"), "Mac OS X", null);
        assertEquals(Paths.get("/Users/me/Library/Application Support"), locator.dataDirectory());
    }

    @Test
    void missingHomeFails() {
        DataDirectoryLocator locator = new DataDirectoryLocator(Map.of(), "Linux", null);
        IllegalStateException e = assertThrows(IllegalStateException.class, locator::dataDirectory);
        assertTrue(e.getMessage().contains("no base directories"));
    }
}
