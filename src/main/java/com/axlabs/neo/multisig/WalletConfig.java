package com.axlabs.neo.multisig;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Settings shared by all wallets of a deployment. Loaded from a properties file on the classpath, with the following
 * keys:
 * <pre>
 *  max_signers=50
 *  domain_name=MultiSigWallet
 *  domain_version=1
 *  network_magic=860833102
 * </pre>
 * Missing keys fall back to the defaults shown above.
 */
public class WalletConfig {

    public static final String PROPS_FILE = "wallet.properties";

    // property names
    static final String MAX_SIGNERS_KEY = "max_signers";
    static final String DOMAIN_NAME_KEY = "domain_name";
    static final String DOMAIN_VERSION_KEY = "domain_version";
    static final String NETWORK_MAGIC_KEY = "network_magic";

    public static final int DEFAULT_MAX_SIGNERS = 50;
    public static final String DEFAULT_DOMAIN_NAME = "MultiSigWallet";
    public static final String DEFAULT_DOMAIN_VERSION = "1";
    public static final long MAINNET_MAGIC = 860833102L;

    private final int maxSigners;
    private final String domainName;
    private final String domainVersion;
    private final long networkMagic;

    public WalletConfig(int maxSigners, String domainName, String domainVersion, long networkMagic) {
        if (maxSigners < 1) {
            throw new IllegalArgumentException("Maximum number of signers must be positive");
        }
        if (domainName == null || domainName.isEmpty() || domainVersion == null || domainVersion.isEmpty()) {
            throw new IllegalArgumentException("Domain name and version must not be empty");
        }
        if (networkMagic < 0 || networkMagic > 0xFFFFFFFFL) {
            throw new IllegalArgumentException("Network magic must be an unsigned 32-bit number");
        }
        this.maxSigners = maxSigners;
        this.domainName = domainName;
        this.domainVersion = domainVersion;
        this.networkMagic = networkMagic;
    }

    public static WalletConfig defaults() {
        return new WalletConfig(DEFAULT_MAX_SIGNERS, DEFAULT_DOMAIN_NAME, DEFAULT_DOMAIN_VERSION, MAINNET_MAGIC);
    }

    public static WalletConfig load() {
        return load(PROPS_FILE);
    }

    /**
     * Loads the configuration from the given classpath resource. If the resource does not exist, the defaults are
     * used.
     *
     * @param resource The name of the properties file.
     * @return the configuration.
     */
    public static WalletConfig load(String resource) {
        Properties props = new Properties();
        try (InputStream in = WalletConfig.class.getClassLoader().getResourceAsStream(resource)) {
            if (in != null) {
                props.load(in);
            }
        } catch (IOException e) {
            throw new RuntimeException(e);
        }
        return new WalletConfig(
                Integer.parseInt(props.getProperty(MAX_SIGNERS_KEY, String.valueOf(DEFAULT_MAX_SIGNERS)).trim()),
                props.getProperty(DOMAIN_NAME_KEY, DEFAULT_DOMAIN_NAME).trim(),
                props.getProperty(DOMAIN_VERSION_KEY, DEFAULT_DOMAIN_VERSION).trim(),
                Long.parseLong(props.getProperty(NETWORK_MAGIC_KEY, String.valueOf(MAINNET_MAGIC)).trim()));
    }

    public WalletConfig withMaxSigners(int maxSigners) {
        return new WalletConfig(maxSigners, domainName, domainVersion, networkMagic);
    }

    public WalletConfig withNetworkMagic(long networkMagic) {
        return new WalletConfig(maxSigners, domainName, domainVersion, networkMagic);
    }

    public int getMaxSigners() {
        return maxSigners;
    }

    public String getDomainName() {
        return domainName;
    }

    public String getDomainVersion() {
        return domainVersion;
    }

    public long getNetworkMagic() {
        return networkMagic;
    }
}
