package org.tsticker.manager;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.tsticker.manager.api.AppInitException;
import org.tsticker.manager.api.CollectionNotFoundException;
import org.tsticker.manager.api.CorruptedIndexException;
import org.tsticker.manager.api.InvalidCredentialException;
import org.tsticker.manager.api.InvalidPackException;
import org.tsticker.manager.api.NotLoggedInException;
import org.tsticker.manager.api.PackAlreadyExistsException;
import org.tsticker.manager.api.PackNotFoundException;
import org.tsticker.manager.api.StickerPackLink;
import org.tsticker.manager.api.StickerType;
import org.tsticker.manager.encoder.PassThroughStickerEncoder;
import org.tsticker.manager.storage.pack.IndexStore;
import org.tsticker.manager.util.IOUtils;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StickerAccountFilesTest {

    @TempDir
    Path tempDir;

    private FakeRemoteClient client;
    private StickerAccountFiles accountFiles;

    @BeforeEach
    void setUp() {
        client = new FakeRemoteClient();
        accountFiles = new StickerAccountFiles(tempDir.resolve("config").toFile(),
                new Settings(20, Duration.ZERO, 4, 1),
                (token, proxy) -> client,
                new PassThroughStickerEncoder());
    }

    @Test
    void managerRequiresLogin() {
        assertThrows(NotLoggedInException.class, () -> accountFiles.initManager());
    }

    @Test
    void loginStoresCredential() throws Exception {
        final var credential = accountFiles.login("123:abc", "777", null);

        assertEquals("test_bot", credential.operator().username());
        assertTrue(client.closed);
        try (var manager = accountFiles.initManager()) {
            assertEquals("777", manager.getCredential().ownerId());
        }
        assertTrue(accountFiles.logout());
        assertFalse(accountFiles.logout());
    }

    @Test
    void loginRejectsNonNumericOwner() {
        assertThrows(InvalidCredentialException.class, () -> accountFiles.login("123:abc", "me", null));
        assertEquals(List.of(), client.calls);
    }

    @Test
    void rejectedTokenIsNotStored() {
        client.failGetOperator = true;

        assertThrows(AppInitException.class, () -> accountFiles.login("123:abc", "777", null));
        assertThrows(NotLoggedInException.class, () -> accountFiles.initManager());
    }

    @Test
    void withoutRemoteClientOnlyLogoutWorks() {
        final var offline = new StickerAccountFiles(tempDir.resolve("config").toFile(),
                Settings.DEFAULT,
                null,
                new PassThroughStickerEncoder());

        assertThrows(AppInitException.class, () -> offline.login("123:abc", "777", null));
        assertDoesNotThrow(() -> assertFalse(offline.logout()));
    }

    @Test
    void initCreatesEmptyPack() throws Exception {
        accountFiles.login("123:abc", "777", null);
        try (var manager = accountFiles.initManager()) {
            final var result = manager.initPack(tempDir, "cats", "Cats", StickerType.REGULAR);

            assertFalse(result.remoteExists());
            assertEquals(tempDir.resolve("cats"), result.packDir());
            assertEquals("cats_by_test_bot", result.pack().name());
            assertEquals("42", result.pack().operatorId());
            assertTrue(Files.isDirectory(result.packDir().resolve("stickers")));
            assertEquals(result.pack(), manager.loadPack(result.packDir()));

            assertThrows(PackAlreadyExistsException.class,
                    () -> manager.initPack(tempDir, "cats", "Cats", StickerType.REGULAR));
        }
    }

    @Test
    void initPullsExistingCollection() throws Exception {
        client.putCollection("cats_by_test_bot", "Cats", StickerType.REGULAR);
        client.addRemote("cats_by_test_bot", TestFiles.png(50, 1), "😺");
        accountFiles.login("123:abc", "777", null);

        try (var manager = accountFiles.initManager()) {
            final var result = manager.initPack(tempDir, "cats", "Cats", StickerType.REGULAR);

            assertTrue(result.remoteExists());
            assertEquals(1, result.pull().downloaded());
            assertEquals(1, result.pack().emotes().size());
        }
    }

    @Test
    void initValidatesInput() throws Exception {
        accountFiles.login("123:abc", "777", null);
        try (var manager = accountFiles.initManager()) {
            assertThrows(InvalidPackException.class,
                    () -> manager.initPack(tempDir, "bad-name", "Cats", StickerType.REGULAR));
            assertThrows(InvalidPackException.class,
                    () -> manager.initPack(tempDir, "cats", "", StickerType.REGULAR));
            assertFalse(Files.exists(tempDir.resolve("cats")));
        }
    }

    @Test
    void traceCreatesPackFromRemote() throws Exception {
        client.putCollection("dogs_by_other_bot", "Dogs", StickerType.CUSTOM_EMOJI);
        client.addRemote("dogs_by_other_bot", TestFiles.png(50, 1), "🐶");
        accountFiles.login("123:abc", "777", null);

        try (var manager = accountFiles.initManager()) {
            final var result = manager.tracePack(tempDir,
                    StickerPackLink.fromLink("https://t.me/addstickers/dogs_by_other_bot"));

            assertEquals(tempDir.resolve("dogs_by_other_bot"), result.packDir());
            assertEquals("Dogs", result.pack().title());
            assertEquals(StickerType.CUSTOM_EMOJI, result.pack().stickerType());
            assertEquals(1, result.pull().downloaded());

            assertThrows(CollectionNotFoundException.class,
                    () -> manager.tracePack(tempDir, StickerPackLink.fromLink("missing")));
        }
    }

    @Test
    void downloadWritesFilesWithoutIndex() throws Exception {
        client.putCollection("dogs", "Dogs", StickerType.REGULAR);
        client.addRemote("dogs", TestFiles.png(50, 1), "🐶");
        client.addRemote("dogs", TestFiles.png(60, 2), "🐕");
        accountFiles.login("123:abc", "777", null);

        try (var manager = accountFiles.initManager()) {
            assertEquals(2, manager.downloadPack(tempDir, StickerPackLink.fromLink("dogs")));
        }

        assertTrue(Files.exists(tempDir.resolve("dogs").resolve("u1.png")));
        assertTrue(Files.exists(tempDir.resolve("dogs").resolve("u2.png")));
        assertFalse(Files.exists(tempDir.resolve("dogs").resolve("index.json")));
    }

    @Test
    void loadPackChecksPreconditions() throws Exception {
        accountFiles.login("123:abc", "777", null);
        try (var manager = accountFiles.initManager()) {
            assertThrows(PackNotFoundException.class, () -> manager.sync(tempDir));

            final var packDir = Files.createDirectories(tempDir.resolve("pack"));
            Files.writeString(packDir.resolve("index.json"), "{}");
            assertThrows(CorruptedIndexException.class, () -> manager.push(packDir));
            assertTrue(client.calls.stream().allMatch("getOperator"::equals));
        }
    }

    @Test
    void packOfAnotherOperatorStillLoads() throws Exception {
        accountFiles.login("123:abc", "777", null);
        final var packDir = Files.createDirectories(tempDir.resolve("pack"));
        Files.createDirectories(packDir.resolve("stickers"));
        final var pack = IndexStore.create("Cats", "cats_by_someone", StickerType.REGULAR, "99");
        new IndexStore().save(packDir.resolve("index.json"), pack);

        try (var manager = accountFiles.initManager()) {
            assertEquals(pack, manager.loadPack(packDir));
        }
    }

    @Test
    void missingStickerDirectoryStopsPushBeforeRemoteCalls() throws Exception {
        client.putCollection("cats_by_test_bot", "Cats", StickerType.REGULAR);
        client.addRemote("cats_by_test_bot", TestFiles.png(50, 1), "😺");
        client.addRemote("cats_by_test_bot", TestFiles.png(60, 2), "😸");
        accountFiles.login("123:abc", "777", null);

        try (var manager = accountFiles.initManager()) {
            final var packDir = manager.initPack(tempDir, "cats", "Cats", StickerType.REGULAR).packDir();
            IOUtils.deleteRecursively(packDir.resolve("stickers"));
            client.calls.clear();

            assertThrows(PackNotFoundException.class, () -> manager.push(packDir));
            assertThrows(PackNotFoundException.class, () -> manager.sync(packDir));
            assertEquals(List.of(), client.calls);
            assertEquals(2, client.collection("cats_by_test_bot").size());
        }
    }

    @Test
    void syncWithoutRemoteCollectionFails() throws Exception {
        accountFiles.login("123:abc", "777", null);
        try (var manager = accountFiles.initManager()) {
            final var result = manager.initPack(tempDir, "cats", "Cats", StickerType.REGULAR);
            assertNull(result.pull());

            assertThrows(CollectionNotFoundException.class, () -> manager.sync(result.packDir()));
        }
    }
}
