package com.quikdb.blockchain.service;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for blockchain connectivity.
 */
@Configuration
@ConfigurationProperties(prefix = "quikdb.blockchain")
public class BlockchainConfig {

    private String nodeUrl = "http://localhost:8545";
    private String rewardTokenAddress;
    private String nodeRegistryAddress;
    private String treasuryAddress;
    private String privateKey;
    private long gasPrice = 20_000_000_000L; // 20 Gwei
    private long gasLimit = 6_721_975L;
    private boolean mintRewards = true;
    private boolean enabled = false;

    public String getNodeUrl() { return nodeUrl; }
    public void setNodeUrl(String nodeUrl) { this.nodeUrl = nodeUrl; }
    public String getRewardTokenAddress() { return rewardTokenAddress; }
    public void setRewardTokenAddress(String addr) { this.rewardTokenAddress = addr; }
    public String getNodeRegistryAddress() { return nodeRegistryAddress; }
    public void setNodeRegistryAddress(String addr) { this.nodeRegistryAddress = addr; }
    public String getTreasuryAddress() { return treasuryAddress; }
    public void setTreasuryAddress(String addr) { this.treasuryAddress = addr; }
    public String getPrivateKey() { return privateKey; }
    public void setPrivateKey(String privateKey) { this.privateKey = privateKey; }
    public long getGasPrice() { return gasPrice; }
    public void setGasPrice(long gasPrice) { this.gasPrice = gasPrice; }
    public long getGasLimit() { return gasLimit; }
    public void setGasLimit(long gasLimit) { this.gasLimit = gasLimit; }
    public boolean isMintRewards() { return mintRewards; }
    public void setMintRewards(boolean mintRewards) { this.mintRewards = mintRewards; }
    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }
}
