package com.zzf.agentdock.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Inline base64 image attached to a user message.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ImageAttachment {
    private String mediaType;
    private String data;
}
