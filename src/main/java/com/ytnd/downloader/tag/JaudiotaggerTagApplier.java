package com.ytnd.downloader.tag;

import com.ytnd.downloader.model.MediaEntry;
import lombok.extern.slf4j.Slf4j;
import org.jaudiotagger.audio.AudioFile;
import org.jaudiotagger.audio.AudioFileIO;
import org.jaudiotagger.tag.FieldKey;
import org.jaudiotagger.tag.KeyNotFoundException;
import org.jaudiotagger.tag.Tag;

import java.nio.file.Path;

/**
 * Tags MP3, M4A, FLAC and Ogg Vorbis files through JAudioTagger.
 * The source URL goes into the comment field, the description into the subtitle field.
 * When a format has no subtitle field the description is appended to the comment instead.
 */
@Slf4j
public class JaudiotaggerTagApplier implements TagApplier {

    @Override
    public void apply(Path file, AudioContainer container, MediaEntry entry) throws TagWriteException {
        try {
            AudioFile audioFile = AudioFileIO.read(file.toFile());
            Tag tag = audioFile.getTagOrCreateAndSetDefault();

            setIfPresent(tag, FieldKey.TITLE, entry.getTitle());
            setIfPresent(tag, FieldKey.ARTIST, entry.getUploader());
            setIfPresent(tag, FieldKey.ALBUM, entry.getAlbum());
            setIfPresent(tag, FieldKey.YEAR, entry.getUploadDate());

            String url = entry.getCanonicalUrl() == null ? "" : entry.getCanonicalUrl();
            String description = entry.getDescription();
            if (description != null && !description.isEmpty()) {
                try {
                    tag.setField(FieldKey.SUBTITLE, description);
                } catch (KeyNotFoundException | UnsupportedOperationException e) {
                    log.debug("{} has no subtitle field, folding description into comment", container);
                    url = url.isEmpty() ? description : url + "\n\n" + description;
                }
            }
            setIfPresent(tag, FieldKey.COMMENT, url);

            audioFile.commit();
        } catch (Exception e) {
            throw new TagWriteException("Failed to tag " + file.getFileName() + ": " + e.getMessage(), e);
        }
    }

    private void setIfPresent(Tag tag, FieldKey key, String value) throws Exception {
        if (value != null && !value.isEmpty()) {
            tag.setField(key, value);
        }
    }
}
