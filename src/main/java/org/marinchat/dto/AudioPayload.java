package org.marinchat.dto;

/**
 * Audio reçu pour une transcription, le temps d'une seule requête.
 */
public record AudioPayload(byte[] data, String contentType, String filename) {

    public AudioPayload {
        data = (data == null) ? new byte[0] : data;
    }

    public int size() {
        return data.length;
    }
}
