package com.watcherbridge.common.collab;

/**
 * Speech recognition and synthesis backend.
 */
public interface SpeechProvider {

    /**
     * @return the transcript, or an empty string when nothing was recognized
     */
    String recognize(byte[] audio);

    /**
     * @return encoded audio, or an empty array when synthesis is unavailable
     */
    byte[] synthesize(String text);

    /** Backend that recognizes nothing and synthesizes nothing. */
    SpeechProvider NONE = new SpeechProvider() {
        @Override
        public String recognize(byte[] audio) {
            return "";
        }

        @Override
        public byte[] synthesize(String text) {
            return new byte[0];
        }
    };
}
