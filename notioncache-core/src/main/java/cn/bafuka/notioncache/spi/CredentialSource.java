package cn.bafuka.notioncache.spi;

/**
 * 凭据来源 SPI 接口
 * 用于对接不同的 Token 存放位置（配置属性、本地 JSON 文件等）
 */
public interface CredentialSource {

    /**
     * 读取 API Token
     *
     * @return Token，未配置返回 null
     */
    String getApiToken();

    /**
     * 凭据来源类型标识
     *
     * @return 类型名称（如 "properties", "json-file"）
     */
    String getType();
}
