package com.anime.library.catalog.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.anime.library.catalog.model.LibFile;
import com.anime.library.catalog.repository.LibFileRepository;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class LibraryReaderTest {

    private LibFileRepository libFileRepository;
    private LibraryReader reader;

    @BeforeEach
    void setUp() {
        libFileRepository = mock(LibFileRepository.class);
        reader = new LibraryReader(libFileRepository);
    }

    @Test
    void getFileSplitsDirectoryAndName() {
        LibFile file = new LibFile(1L, "/anime/Show A", "01.mkv");
        when(libFileRepository.findByLibraryIdAndPathAndNameAndRemovedFalse(1L, "/anime/Show A", "01.mkv"))
                .thenReturn(Optional.of(file));

        assertEquals(Optional.of(file), reader.getFile(1L, "//anime/Show A//01.mkv"));
    }

    @Test
    void getFileAtTopLevelUsesRootDirectory() {
        reader.getFile(1L, "/anime");

        verify(libFileRepository).findByLibraryIdAndPathAndNameAndRemovedFalse(1L, "/", "anime");
    }

    @Test
    void firstSubFilesNormalizeTrailingSlash() {
        reader.getFirstSubFilesWithNoAnime(2L, "/anime/");

        verify(libFileRepository).findAllByLibraryIdAndPathAndAnimeIdIsNullAndRemovedFalse(2L, "/anime");
    }

    @Test
    void allSubFilesExcludeSiblingsSharingAPrefix() {
        LibFile inside = new LibFile(1L, "/anime/Show", "01.mkv");
        LibFile nested = new LibFile(1L, "/anime/Show/extras", "op.mkv");
        LibFile sibling = new LibFile(1L, "/anime/Show 2", "01.mkv");
        when(libFileRepository.findAllByLibraryIdAndPathStartingWithAndRemovedFalse(1L, "/anime/Show"))
                .thenReturn(List.of(inside, nested, sibling));

        List<LibFile> files = reader.getAllSubFiles(1L, "/anime/Show");

        assertEquals(List.of(inside, nested), files);
    }

    @Test
    void relativePathsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> reader.getFirstSubFiles(1L, "anime"));
        assertTrue(LibraryReader.normalize("/").equals("/"));
    }
}
