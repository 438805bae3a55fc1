package com.axlabs.neo.multisig.factory;

import com.axlabs.neo.multisig.BlockTime;
import com.axlabs.neo.multisig.ContractRegistry;
import com.axlabs.neo.multisig.MultiSigWallet;
import com.axlabs.neo.multisig.Paginator;
import com.axlabs.neo.multisig.ValidationException;
import com.axlabs.neo.multisig.WalletConfig;
import io.neow3j.contract.SmartContract;
import io.neow3j.types.Hash160;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Creates wallets and deploys them into a {@link ContractRegistry}.
 * <p>
 * The address of a wallet is derived like the hash of a contract deployed on Neo: from the deployer, a salt and the
 * wallet's domain name. With a caller-chosen salt the address can be predicted before the wallet exists. Without
 * one, the factory uses its own running counter.
 */
public class WalletFactory {

    private static final Logger log = LoggerFactory.getLogger(WalletFactory.class);

    private final Hash160 deployer;
    private final ContractRegistry contracts;
    private final WalletConfig config;
    private final BlockTime time;
    private final List<MultiSigWallet> wallets = new ArrayList<>();
    private long nextSalt;

    /**
     * Creates a factory whose wallets take the time from the system clock.
     */
    public WalletFactory(Hash160 deployer, ContractRegistry contracts, WalletConfig config) {
        this(deployer, contracts, config, BlockTime.system());
    }

    public WalletFactory(Hash160 deployer, ContractRegistry contracts, WalletConfig config, BlockTime time) {
        this.deployer = deployer;
        this.contracts = contracts;
        this.config = config;
        this.time = time;
    }

    /**
     * Creates a wallet at the next free address derived from the factory's counter.
     *
     * @param signers The initial signers.
     * @return the wallet.
     */
    public synchronized MultiSigWallet createWallet(List<Hash160> signers) {
        Hash160 address = predictAddress(nextSalt++);
        while (contracts.contains(address)) {
            address = predictAddress(nextSalt++);
        }
        return deploy(address, signers);
    }

    /**
     * Creates a wallet at the address given by {@link #predictAddress(long)} for {@code salt}.
     *
     * @param signers The initial signers.
     * @param salt    The salt.
     * @return the wallet.
     */
    public synchronized MultiSigWallet createWallet(List<Hash160> signers, long salt) {
        Hash160 address = predictAddress(salt);
        if (contracts.contains(address)) {
            throw new ValidationException("WalletFactory.createWallet", "Address already in use " + address);
        }
        return deploy(address, signers);
    }

    /**
     * @param salt The salt.
     * @return the address a wallet created with {@code salt} gets.
     */
    public Hash160 predictAddress(long salt) {
        return SmartContract.calcContractHash(deployer, salt, config.getDomainName());
    }

    public synchronized int getWalletCount() {
        return wallets.size();
    }

    /**
     * Gets the addresses of the created wallets on the given page, in creation order.
     *
     * @param page         The page, starting at 0.
     * @param itemsPerPage The number of wallets per page.
     * @return the page.
     */
    public synchronized Paginator.Paginated<Hash160> getWallets(int page, int itemsPerPage) {
        List<Hash160> addresses = new ArrayList<>(wallets.size());
        for (MultiSigWallet wallet : wallets) {
            addresses.add(wallet.getAddress());
        }
        return Paginator.paginate(addresses, page, itemsPerPage, "WalletFactory.getWallets");
    }

    /**
     * @return the wallet at {@code address}, or null if this factory did not create one there.
     */
    public synchronized MultiSigWallet getWallet(Hash160 address) {
        for (MultiSigWallet wallet : wallets) {
            if (wallet.getAddress().equals(address)) {
                return wallet;
            }
        }
        return null;
    }

    private MultiSigWallet deploy(Hash160 address, List<Hash160> signers) {
        MultiSigWallet wallet = new MultiSigWallet(address, signers, config, contracts, time);
        contracts.deploy(address, wallet);
        wallets.add(wallet);
        log.info("Deployed wallet {} with {} signers", address, signers.size());
        return wallet;
    }
}
