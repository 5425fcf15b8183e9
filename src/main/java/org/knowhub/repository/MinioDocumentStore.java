package org.knowhub.repository;

import io.minio.BucketExistsArgs;
import io.minio.GetObjectArgs;
import io.minio.GetObjectResponse;
import io.minio.MakeBucketArgs;
import io.minio.MinioClient;
import io.minio.PutObjectArgs;
import io.minio.RemoveObjectArgs;
import org.knowhub.DTO.StoredDocument;
import org.knowhub.exception.CustomException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Repository;

import java.io.ByteArrayInputStream;

@Repository
public class MinioDocumentStore implements DocumentStore {

    private static final Logger logger = LoggerFactory.getLogger(MinioDocumentStore.class);

    private final MinioClient minioClient;
    private final String bucket;
    private volatile boolean bucketChecked;

    public MinioDocumentStore(MinioClient minioClient, @Value("${minio.bucket:documents}") String bucket) {
        this.minioClient = minioClient;
        this.bucket = bucket;
    }

    @Override
    public void store(String key, byte[] content, String contentType) {
        try {
            ensureBucket();
            minioClient.putObject(PutObjectArgs.builder()
                    .bucket(bucket)
                    .object(key)
                    .stream(new ByteArrayInputStream(content), content.length, -1)
                    .contentType(contentType != null ? contentType : "application/octet-stream")
                    .build());
            logger.info("文档已写入对象存储: bucket={}, key={}, size={}", bucket, key, content.length);
        } catch (Exception e) {
            // MinIO 的受检异常统一转为业务异常
            throw new CustomException("文档存储失败: " + e.getMessage(), HttpStatus.INTERNAL_SERVER_ERROR, e);
        }
    }

    @Override
    public StoredDocument fetch(String key) {
        try (GetObjectResponse response = minioClient.getObject(GetObjectArgs.builder()
                .bucket(bucket)
                .object(key)
                .build())) {
            byte[] bytes = response.readAllBytes();
            return new StoredDocument(bytes, response.headers().get("Content-Type"));
        } catch (Exception e) {
            throw new CustomException("读取文档失败: " + key + ", " + e.getMessage(), HttpStatus.INTERNAL_SERVER_ERROR, e);
        }
    }

    @Override
    public void remove(String key) {
        try {
            minioClient.removeObject(RemoveObjectArgs.builder().bucket(bucket).object(key).build());
        } catch (Exception e) {
            throw new CustomException("删除MinIO文件失败: " + e.getMessage(), HttpStatus.INTERNAL_SERVER_ERROR, e);
        }
    }

    private void ensureBucket() throws Exception {
        if (bucketChecked) {
            return;
        }
        if (!minioClient.bucketExists(BucketExistsArgs.builder().bucket(bucket).build())) {
            minioClient.makeBucket(MakeBucketArgs.builder().bucket(bucket).build());
            logger.info("创建存储桶: {}", bucket);
        }
        bucketChecked = true;
    }
}
