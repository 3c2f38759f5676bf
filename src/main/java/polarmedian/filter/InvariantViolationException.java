/*
 *     This file is part of PolarMedian.
 *
 *     PolarMedian is free software: you can redistribute it and/or modify
 *     it under the terms of the GNU General Public License as published by
 *     the Free Software Foundation, either version 3 of the License, or
 *     (at your option) any later version.
 *
 *     PolarMedian is distributed in the hope that it will be useful,
 *     but WITHOUT ANY WARRANTY; without even the implied warranty of
 *     MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 *     GNU General Public License for more details.
 *
 *     You should have received a copy of the GNU General Public License
 *     along with PolarMedian.  If not, see <http://www.gnu.org/licenses/>.
 */

package polarmedian.filter;

/**
 * Internal consistency fault in the median engine, e.g. the heap tracker and frequency tree disagreeing, or a
 * value being removed from a window that never contained it. Never recovered from.
 */
public class InvariantViolationException extends IllegalStateException
{
	static final long serialVersionUID = 42L;

	public InvariantViolationException(String message)
	{
		super(message);
	}
}
