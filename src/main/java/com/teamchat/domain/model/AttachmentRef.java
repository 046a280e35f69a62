package com.teamchat.domain.model;

/**
 * 附件引用（不透明）：上传/存储由外部协作方负责，这里只保存它返回的元数据。
 */
public record AttachmentRef(
        String url,
        String kind,
        String filename,
        String externalId
) {
}
