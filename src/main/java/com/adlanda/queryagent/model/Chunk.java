package com.adlanda.queryagent.model;

/**
 * A contiguous slice of an indexed document.
 *
 * @param id        Stable identifier, derived from the session, position and text
 * @param content   The text of the slice, copied verbatim from the document
 * @param position  Sequence position of the slice within the document, starting at 0
 */
public record Chunk(
        String id,
        String content,
        int position
) {}
