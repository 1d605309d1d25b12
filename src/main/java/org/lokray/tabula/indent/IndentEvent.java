package org.lokray.tabula.indent;

/**
 * Indentation annotation of one non-blank logical line: its leading TAB depth and the
 * block markers the resolver inserted in front of it.
 */
public final class IndentEvent
{
	private final int line;
	private final int depth;
	private final boolean blockEnter;
	private final int blockExits;

	public IndentEvent(int line, int depth, boolean blockEnter, int blockExits)
	{
		this.line = line;
		this.depth = depth;
		this.blockEnter = blockEnter;
		this.blockExits = blockExits;
	}

	public int getLine()
	{
		return line;
	}

	/**
	 * @return the number of leading TABs on the line.
	 */
	public int getDepth()
	{
		return depth;
	}

	public boolean isBlockEnter()
	{
		return blockEnter;
	}

	/**
	 * @return how many blocks were closed in front of this line.
	 */
	public int getBlockExits()
	{
		return blockExits;
	}

	@Override
	public String toString()
	{
		StringBuilder sb = new StringBuilder("line ").append(line).append(" depth ").append(depth);
		if (blockEnter)
		{
			sb.append(" BlockEnter");
		}
		if (blockExits > 0)
		{
			sb.append(" BlockExit(").append(blockExits).append(')');
		}
		return sb.toString();
	}
}
