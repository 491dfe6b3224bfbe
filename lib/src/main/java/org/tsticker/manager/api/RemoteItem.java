package org.tsticker.manager.api;

/**
 * One sticker of a remote collection.
 *
 * @param contentId       handle used to fetch or delete the file, may change between fetches
 * @param uniqueContentId content addressed id, stable across fetches
 */
public record RemoteItem(String contentId, String uniqueContentId, long byteSize, String emoji) {}
