package com.axlabs.neo.multisig;

import io.neow3j.constants.NeoConstants;
import io.neow3j.serialization.BinaryReader;
import io.neow3j.serialization.BinaryWriter;
import io.neow3j.types.Hash160;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Builds and decodes the operations a wallet runs on itself. Their payload is a one byte selector followed by the
 * argument: a 20 byte script hash for the signer calls, a 32-bit little-endian proposal id for the cancel call.
 */
public final class GovernanceCalls {

    static final byte ADD_SIGNER = 0x01;
    static final byte REMOVE_SIGNER = 0x02;
    static final byte CANCEL_PROPOSAL = 0x03;

    private GovernanceCalls() {
    }

    /**
     * @param wallet The wallet whose signer set should change.
     * @param signer The signer to add.
     * @return the operation adding the signer when executed by {@code wallet}.
     */
    public static Operation addSigner(Hash160 wallet, Hash160 signer) {
        return new Operation(wallet, encode(ADD_SIGNER, signer));
    }

    public static Operation removeSigner(Hash160 wallet, Hash160 signer) {
        return new Operation(wallet, encode(REMOVE_SIGNER, signer));
    }

    public static Operation cancelProposal(Hash160 wallet, int proposalId) {
        try (ByteArrayOutputStream stream = new ByteArrayOutputStream();
             BinaryWriter writer = new BinaryWriter(stream)) {
            writer.writeByte(CANCEL_PROPOSAL);
            writer.writeInt32(proposalId);
            return new Operation(wallet, stream.toByteArray());
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static byte[] encode(byte selector, Hash160 signer) {
        try (ByteArrayOutputStream stream = new ByteArrayOutputStream();
             BinaryWriter writer = new BinaryWriter(stream)) {
            writer.writeByte(selector);
            writer.write(signer.toArray());
            return stream.toByteArray();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Runs the governance call encoded in {@code data} on {@code wallet} with the given capability.
     *
     * @return the call's return value, always null.
     * @throws IOException if the payload is truncated.
     */
    static Object dispatch(MultiSigWallet wallet, GovernanceCapability capability, byte[] data) throws IOException {
        if (data.length == 0) {
            throw new IllegalArgumentException("Empty governance call");
        }
        BinaryReader reader = new BinaryReader(data);
        byte selector = reader.readByte();
        switch (selector) {
            case ADD_SIGNER:
                wallet.addSigner(capability, new Hash160(reader.readBytes(NeoConstants.HASH160_SIZE)));
                return null;
            case REMOVE_SIGNER:
                wallet.removeSigner(capability, new Hash160(reader.readBytes(NeoConstants.HASH160_SIZE)));
                return null;
            case CANCEL_PROPOSAL:
                wallet.cancelProposal(capability, reader.readInt32());
                return null;
            default:
                throw new IllegalArgumentException("Unknown governance call " + selector);
        }
    }
}
