package com.axlabs.neo.multisig;

import io.neow3j.crypto.Hash;
import io.neow3j.serialization.BinaryWriter;
import io.neow3j.types.Hash160;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * The signing domain of a wallet. Every vote digest is bound to the protocol name and version, the network magic and
 * the wallet's address, so a signature cannot be replayed on another network or against another wallet.
 * <p>
 * The digest is computed as
 * <pre>
 *  sha256(0x19 || 0x01 || domainSeparator || sha256(voteTypeHash || proposalId || support || nonce))
 * </pre>
 * where {@code domainSeparator = sha256(domainTypeHash || sha256(name) || sha256(version) || networkMagic || wallet)}
 * and integers are written as 64-bit little-endian values.
 */
public final class DomainInfo {

    static final String DOMAIN_TYPE = "WalletDomain(string name,string version,int64 network,Hash160 wallet)";
    static final String VOTE_TYPE = "Vote(int64 proposalId,bool support,int64 nonce)";
    private static final byte[] DIGEST_PREFIX = new byte[]{0x19, 0x01};

    private final String name;
    private final String version;
    private final long networkMagic;
    private final Hash160 wallet;
    private final byte[] separator;

    public DomainInfo(String name, String version, long networkMagic, Hash160 wallet) {
        this.name = name;
        this.version = version;
        this.networkMagic = networkMagic;
        this.wallet = wallet;
        this.separator = calcSeparator();
    }

    public String getName() {
        return name;
    }

    public String getVersion() {
        return version;
    }

    public long getNetworkMagic() {
        return networkMagic;
    }

    public Hash160 getWallet() {
        return wallet;
    }

    public byte[] getSeparator() {
        return separator.clone();
    }

    /**
     * Computes the digest a signer signs to vote on a proposal without submitting the vote themselves.
     *
     * @param proposalId The proposal to vote on.
     * @param support    True for a yes-vote, false for retracting one.
     * @param nonce      The signer's current nonce.
     * @return the digest.
     */
    public byte[] voteDigest(int proposalId, boolean support, long nonce) {
        byte[] structHash = Hash.sha256(write(w -> {
            w.write(typeHash(VOTE_TYPE));
            w.writeInt64(proposalId);
            w.writeByte(support ? (byte) 1 : (byte) 0);
            w.writeInt64(nonce);
        }));
        return Hash.sha256(write(w -> {
            w.write(DIGEST_PREFIX);
            w.write(separator);
            w.write(structHash);
        }));
    }

    private byte[] calcSeparator() {
        return Hash.sha256(write(w -> {
            w.write(typeHash(DOMAIN_TYPE));
            w.write(typeHash(name));
            w.write(typeHash(version));
            w.writeInt64(networkMagic);
            w.write(wallet.toArray());
        }));
    }

    private static byte[] typeHash(String value) {
        return Hash.sha256(value.getBytes(StandardCharsets.UTF_8));
    }

    private static byte[] write(Encoder encoder) {
        try (ByteArrayOutputStream stream = new ByteArrayOutputStream();
             BinaryWriter writer = new BinaryWriter(stream)) {
            encoder.encode(writer);
            return stream.toByteArray();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @FunctionalInterface
    private interface Encoder {
        void encode(BinaryWriter writer) throws IOException;
    }
}
